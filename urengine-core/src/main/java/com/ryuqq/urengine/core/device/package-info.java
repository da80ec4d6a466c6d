/**
 * Devices: the hosts or sources that own ingested resources.
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.device;
