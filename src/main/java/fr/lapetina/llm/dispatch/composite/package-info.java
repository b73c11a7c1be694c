/**
 * Composite calls: one request, several providers, one merged answer.
 *
 * <p>{@link fr.lapetina.llm.dispatch.composite.CompositeDispatcher} holds the registered
 * providers and starts one {@code CompositeCall} per request. Each call moves through
 * {@code PENDING -> IN_FLIGHT -> MERGING -> DONE} and owns the cancellation token handed to
 * every provider it calls.
 */
package fr.lapetina.llm.dispatch.composite;
