/**
 * Lineage graph services: typed edges from external nodes to resources and
 * automatic indexing of newly admitted resources.
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.application.lineage;
