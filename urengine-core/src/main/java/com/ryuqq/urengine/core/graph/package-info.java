/**
 * Lineage graph records: named graphs and typed edges from external node ids to resources.
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.graph;
