/**
 * Immutable domain types shared by the provider clients and the composite dispatcher.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.dispatch.domain.model.RequestEnvelope} - One logical chat/completion call</li>
 *   <li>{@link fr.lapetina.llm.dispatch.domain.model.ProviderResult} - Normalized outcome of one provider call</li>
 *   <li>{@link fr.lapetina.llm.dispatch.domain.model.CompositeResult} - Ordered results plus merged body</li>
 *   <li>{@link fr.lapetina.llm.dispatch.domain.model.ClientConfig} - Per-provider connection settings</li>
 * </ul>
 *
 * <p>Provider failures are carried as data ({@link fr.lapetina.llm.dispatch.domain.model.ErrorDetail})
 * rather than thrown.
 */
package fr.lapetina.llm.dispatch.domain.model;
