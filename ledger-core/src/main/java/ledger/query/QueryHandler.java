package ledger.query;

/**
 * Answers one query type.
 *
 * @param <Q> the query type
 * @param <R> the result type
 */
@FunctionalInterface
public interface QueryHandler<Q extends Query<R>, R> {

    /**
     * Computes the result.
     *
     * @return the result; {@code null} results are returned to the caller but never cached
     * @throws QueryException for expected failures such as a missing or foreign aggregate
     */
    R handle(Q query);
}
