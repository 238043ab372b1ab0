package randompartition.core;

/**
 * Defines which part sizes a partition may use.
 *
 * <p>{@code partSize(1), partSize(2), ...} enumerates the allowed sizes and must be strictly
 * increasing. A return value of {@link #NO_MORE_PARTS} ends the sequence, which is how finite
 * sets such as "parts at most 10" are expressed. The contract is not checked at runtime; a
 * policy that violates it makes the exact samplers loop forever.
 */
@FunctionalInterface
public interface RestrictionPolicy {

  /** Sentinel returned once the sequence of allowed sizes is exhausted. */
  long NO_MORE_PARTS = 0L;

  /**
   * Returns the {@code index}-th allowed part size.
   *
   * @param index 1-based position in the sequence of allowed sizes
   * @return the part size, or {@link #NO_MORE_PARTS} if fewer than {@code index} sizes exist
   */
  long partSize(long index);
}
