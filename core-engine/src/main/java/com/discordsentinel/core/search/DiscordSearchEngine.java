package com.discordsentinel.core.search;

import com.discordsentinel.core.index.CandidateOrdering;
import com.discordsentinel.core.index.ExclusionZone;
import com.discordsentinel.core.model.Discord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.PrimitiveIterator;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Best-first discord search with early abandonment.
 *
 * <h3>Algorithm</h3>
 * <p>
 * For every candidate {@code p} in the outer order, neighbours {@code q} are
 * compared in the inner order while tracking {@code p}'s nearest distance.
 * As soon as one neighbour is closer than the best discord distance found so
 * far, {@code p} is abandoned: its true nearest distance can only be smaller
 * still, so it cannot become the discord. A candidate that survives its whole
 * inner loop replaces the best discord when its nearest distance is strictly
 * larger, so the first candidate in outer order wins ties.
 * </p>
 *
 * <p>
 * Candidates without any non-overlapping neighbour are never reported.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Counters of the last search are kept for diagnostics; an instance is meant
 * for one thread.
 * </p>
 *
 * @since 1.0.0
 */
public class DiscordSearchEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiscordSearchEngine.class);

    private final SubsequenceDistance distance;

    private long distanceComputations;
    private int abandonedCandidates;

    /**
     * @param distance distance over the searched series
     */
    public DiscordSearchEngine(SubsequenceDistance distance) {
        this.distance = Objects.requireNonNull(distance, "Distance must not be null");
    }

    /**
     * Run a search without cancellation.
     *
     * @param ordering candidate ordering over the same series
     * @return the discord, or empty if no candidate has a non-overlapping
     *         neighbour
     */
    public Optional<Discord> search(CandidateOrdering ordering) {
        return search(ordering, () -> false);
    }

    /**
     * Run a search, checking {@code cancelled} before every outer candidate.
     *
     * @param ordering  candidate ordering over the same series
     * @param cancelled polled between candidates
     * @return the discord, or empty if no candidate has a non-overlapping
     *         neighbour
     * @throws CancellationException    if {@code cancelled} returns {@code true}
     * @throws IllegalArgumentException if the ordering does not match the
     *                                  series
     */
    public Optional<Discord> search(CandidateOrdering ordering, BooleanSupplier cancelled) {
        Objects.requireNonNull(ordering, "Ordering must not be null");
        Objects.requireNonNull(cancelled, "Cancellation flag must not be null");
        int n = ordering.windowLength();
        if (n != distance.windowLength() || ordering.positionCount() != distance.windowCount()) {
            throw new IllegalArgumentException("Ordering covers " + ordering.positionCount()
                    + " windows of length " + n + " but the series has " + distance.windowCount()
                    + " windows of length " + distance.windowLength());
        }

        distanceComputations = 0;
        abandonedCandidates = 0;

        double bestDistance = Double.NEGATIVE_INFINITY;
        int bestPosition = -1;

        for (int p : ordering.outerOrder()) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Discord search cancelled after "
                        + distanceComputations + " distance computations");
            }

            double nearest = Double.POSITIVE_INFINITY;
            boolean abandoned = false;

            PrimitiveIterator.OfInt inner = ordering.innerOrder(p);
            while (inner.hasNext()) {
                int q = inner.nextInt();
                if (ExclusionZone.overlaps(p, q, n)) {
                    continue;
                }
                double d = distance.distance(p, q, nearest);
                distanceComputations++;
                if (d < bestDistance) {
                    abandoned = true;
                    break;
                }
                if (d < nearest) {
                    nearest = d;
                }
            }

            if (abandoned) {
                abandonedCandidates++;
                continue;
            }
            if (nearest != Double.POSITIVE_INFINITY && nearest > bestDistance) {
                LOG.trace("New best discord candidate: position={} distance={}", p, nearest);
                bestDistance = nearest;
                bestPosition = p;
            }
        }

        LOG.debug("Search finished: {} candidate(s), {} abandoned, {} distance computation(s)",
                distance.windowCount(), abandonedCandidates, distanceComputations);

        return bestPosition < 0
                ? Optional.empty()
                : Optional.of(new Discord(bestPosition, bestDistance));
    }

    /**
     * @return distances computed by the last search
     */
    public long getDistanceComputations() {
        return distanceComputations;
    }

    /**
     * @return candidates abandoned by the last search
     */
    public int getAbandonedCandidates() {
        return abandonedCandidates;
    }
}
