/**
 * Claim-based work queue: selection filters, exclusive time-bounded claims and the
 * handle that proves a claim.
 *
 * @see workpipe.queue.WorkQueue
 * @see workpipe.queue.ClaimScope
 */
package workpipe.queue;
