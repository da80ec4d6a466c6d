/**
 * Content-addressed resources and their derived transforms.
 *
 * <p>Dedup keys: {@link com.ryuqq.urengine.core.resource.ResourceKey} for resources,
 * {@link com.ryuqq.urengine.core.resource.UniformResourceTransform.TransformKey} for transforms.</p>
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.resource;
