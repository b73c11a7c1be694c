/**
 * Outbound HTTP to providers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.dispatch.infrastructure.http.ProviderClient} - one provider, one call, one normalized result</li>
 *   <li>{@link fr.lapetina.llm.dispatch.infrastructure.http.TransportPool} - bounded slots over a proxy-bound HttpClient</li>
 *   <li>{@link fr.lapetina.llm.dispatch.infrastructure.http.CancellationToken} - explicit cancellation threaded through calls</li>
 *   <li>{@link fr.lapetina.llm.dispatch.infrastructure.http.SseCompletionAssembler} - folds streamed chunks into one completion</li>
 * </ul>
 *
 * <p>Slots are released on every exit path: success, provider error, transport failure,
 * timeout and cancellation.
 */
package fr.lapetina.llm.dispatch.infrastructure.http;
