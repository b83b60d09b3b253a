/**
 * Detection parameters and their YAML loader.
 *
 * <p>
 * {@link com.stationsentinel.core.config.SettingsLoader} reads a
 * {@link com.stationsentinel.core.config.DetectionSettings} document and
 * validates it before returning, so misconfiguration fails fast.
 * </p>
 *
 * @since 1.0.0
 */
package com.stationsentinel.core.config;
