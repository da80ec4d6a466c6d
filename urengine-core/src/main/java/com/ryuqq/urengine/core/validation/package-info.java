/**
 * Write-time validation of structured (JSON) payload fields, backed by Jackson.
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.validation;
