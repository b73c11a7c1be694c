/**
 * Configuration loading.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.dispatch.infrastructure.config.DispatchConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.llm.dispatch.infrastructure.config.ConfigLoader} - YAML loading, placeholder expansion, validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code providers} - upstream endpoints, credentials, explicit proxies</li>
 *   <li>{@code composite} - merge policy, merger and deadline</li>
 *   <li>{@code pool} - connection slot and timeout defaults</li>
 *   <li>{@code proxy} - whether proxy environment variables are honoured</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.llm.dispatch.infrastructure.config;
