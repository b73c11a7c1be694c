/**
 * LLM Dispatch - client dispatch and composite aggregation for OpenAI-compatible providers.
 *
 * <p>This library forwards chat completion requests to one or more remote providers, each
 * through its own resolved proxy and bounded connection pool, and merges their answers
 * according to a merge policy.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.dispatch.DispatcherFactory} - Main entry point for creating
 *       a fully-configured dispatcher from YAML configuration</li>
 *   <li>{@link fr.lapetina.llm.dispatch.composite.CompositeDispatcher} - fan-out and merge</li>
 *   <li>{@link fr.lapetina.llm.dispatch.infrastructure.http.ProviderClient} - one provider</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (DispatcherFactory factory = DispatcherFactory.create("dispatch.yaml")) {
 *     CompositeDispatcher dispatcher = factory.getDispatcher();
 *
 *     RequestEnvelope request = RequestEnvelope.ofChat("gpt-4o-mini",
 *             List.of(RequestEnvelope.Message.user("Hello!")));
 *     CompositeResult result = dispatcher.dispatch(request);
 *
 *     System.out.println(result.mergedBody());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Proxy precedence: explicit, then environment, then none</li>
 *   <li>Merge policies: first-success, all-required, best-effort</li>
 *   <li>Hard per-call timeouts and composite deadlines, no automatic retry</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.llm.dispatch.DispatcherFactory
 * @see fr.lapetina.llm.dispatch.composite.CompositeDispatcher
 */
package fr.lapetina.llm.dispatch;
