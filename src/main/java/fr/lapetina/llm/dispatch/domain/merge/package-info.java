/**
 * Merge policies and response mergers for composite calls.
 *
 * <p>{@link fr.lapetina.llm.dispatch.domain.merge.MergePolicy} decides which provider results
 * are waited for and when a composite call fails; a
 * {@link fr.lapetina.llm.dispatch.domain.merge.ResponseMerger} turns the successful bodies into
 * the merged document.
 *
 * <h2>Built-in Mergers</h2>
 * <ul>
 *   <li>{@code concat-choices} - concatenates choices, sums usage (default)</li>
 *   <li>{@code first} - first success in registration order</li>
 * </ul>
 *
 * @see fr.lapetina.llm.dispatch.domain.merge.MergerFactory
 */
package fr.lapetina.llm.dispatch.domain.merge;
