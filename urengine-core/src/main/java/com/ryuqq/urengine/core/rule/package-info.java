/**
 * Path match and rewrite rules.
 *
 * <p>Lower priority wins, ties keep declaration order. A strict namespace rejects unmatched paths;
 * any other namespace falls back to a match-all rule.</p>
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.rule;
