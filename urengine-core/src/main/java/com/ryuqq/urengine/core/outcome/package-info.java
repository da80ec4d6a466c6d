/**
 * Results of a single executed unit: {@link com.ryuqq.urengine.core.outcome.Ok},
 * {@link com.ryuqq.urengine.core.outcome.Retry} and {@link com.ryuqq.urengine.core.outcome.Fail}.
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.outcome;
