package org.sitemodel.spatial;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sitemodel.core.NoPointsAvailableException;
import org.sitemodel.core.SiteModelException;
import org.sitemodel.points.GroundParameterSet;
import org.sitemodel.sites.TargetSite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pairs every target site with its nearest ground-parameter point.
 *
 * <p>Point sets smaller than {@link #EXHAUSTIVE_SCAN_THRESHOLD} are scanned linearly; larger
 * sets are searched through a {@link SpatialIndex}. With {@code parallelism > 1} targets are
 * split into contiguous shards evaluated on a fixed pool that shares the read-only search
 * structure. Output order always equals input order.</p>
 */
public final class NearestNeighborAssociator {
    private static final Logger logger = LogManager.getLogger(NearestNeighborAssociator.class);

    /**
     * Point count below which a linear scan is used instead of the KD tree.
     */
    public static final int EXHAUSTIVE_SCAN_THRESHOLD = 32;

    private static final int MIN_SHARD_SIZE = 256;

    private final NearestPointSearch search;

    /**
     * Creates an associator over the point set, choosing the search structure by size.
     *
     * @throws NoPointsAvailableException when the set is empty.
     */
    public NearestNeighborAssociator(GroundParameterSet points) {
        this(selectSearch(points));
    }

    /**
     * Creates an associator over an explicit search structure.
     */
    public NearestNeighborAssociator(NearestPointSearch search) {
        this.search = Objects.requireNonNull(search, "search");
    }

    /**
     * Returns the search structure used for queries.
     */
    public NearestPointSearch search() {
        return search;
    }

    /**
     * Associates one target site.
     */
    public AssociationResult associate(TargetSite target) {
        SpatialMatch match = search.nearest(target.longitude(), target.latitude());
        return new AssociationResult(target, match.point(), match.distanceKm());
    }

    /**
     * Associates all targets on the calling thread.
     */
    public List<AssociationResult> associateAll(List<TargetSite> targets) {
        return associateAll(targets, 1);
    }

    /**
     * Associates all targets, sharding across up to {@code parallelism} worker threads.
     *
     * @param targets target sites in emission order.
     * @param parallelism worker count, must be >= 1.
     * @return one result per target, in target order.
     */
    public List<AssociationResult> associateAll(List<TargetSite> targets, int parallelism) {
        Objects.requireNonNull(targets, "targets");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }

        AssociationResult[] results = new AssociationResult[targets.size()];
        int shardCount = Math.min(parallelism, Math.max(1, targets.size() / MIN_SHARD_SIZE));
        if (shardCount <= 1) {
            associateRange(targets, results, 0, targets.size(), null);
            return List.of(results);
        }

        AtomicInteger completed = new AtomicInteger();
        int shardSize = (targets.size() + shardCount - 1) / shardCount;
        ExecutorService executor = Executors.newFixedThreadPool(shardCount);
        try {
            List<Future<?>> futures = new ArrayList<>(shardCount);
            for (int from = 0; from < targets.size(); from += shardSize) {
                int shardFrom = from;
                int shardTo = Math.min(targets.size(), from + shardSize);
                futures.add(executor.submit(() -> associateRange(targets, results, shardFrom, shardTo, completed)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SiteModelException(SiteModelException.REASON_INTERRUPTED, "association interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("association shard failed", cause);
        } finally {
            executor.shutdownNow();
        }
        return List.of(results);
    }

    @Override
    public String toString() {
        return "NearestNeighborAssociator[" + search + "]";
    }

    private void associateRange(
            List<TargetSite> targets,
            AssociationResult[] results,
            int from,
            int to,
            AtomicInteger completed
    ) {
        for (int i = from; i < to; i++) {
            results[i] = associate(targets.get(i));
        }
        if (completed != null) {
            logger.debug("Associated {}/{} sites", completed.addAndGet(to - from), targets.size());
        }
    }

    private static NearestPointSearch selectSearch(GroundParameterSet points) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty()) {
            throw new NoPointsAvailableException("ground-parameter point set is empty");
        }
        if (points.size() < EXHAUSTIVE_SCAN_THRESHOLD) {
            return new ExhaustiveScan(points);
        }
        SpatialIndex index = SpatialIndex.build(points);
        logger.debug("Built {}", index);
        return index;
    }
}
