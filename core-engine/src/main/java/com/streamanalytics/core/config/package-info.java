/**
 * Engine configuration: the {@link com.streamanalytics.core.config.EngineConfig}
 * POJO tree and its SnakeYAML loader.
 *
 * @since 1.0.0
 */
package com.streamanalytics.core.config;
