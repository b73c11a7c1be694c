/**
 * Upstream API shapes.
 *
 * <p>Every provider speaks the OpenAI chat completion protocol, but error bodies differ. A
 * {@link fr.lapetina.llm.dispatch.infrastructure.provider.ProviderDialect} maps a provider's
 * non-2xx responses onto {@link fr.lapetina.llm.dispatch.domain.model.ErrorKind}.
 *
 * <h2>Built-in Dialects</h2>
 * <ul>
 *   <li>{@code openai} / {@code openai-compatible} - {@code {"error": {"type", "code", "message"}}}</li>
 *   <li>{@code gemini} - Google RPC status errors, optionally array-wrapped</li>
 * </ul>
 */
package fr.lapetina.llm.dispatch.infrastructure.provider;
