package org.sitemodel.spatial;

/**
 * Nearest ground-parameter point lookup by great-circle distance.
 *
 * <p>Implementations are immutable after construction and safe for concurrent reads.
 * Exactly equal distances resolve to the point with the smallest load order.</p>
 */
public interface NearestPointSearch {

    /**
     * Finds the point closest to the query coordinate.
     *
     * @param lon query longitude in degrees.
     * @param lat query latitude in degrees.
     * @return nearest point and its great-circle distance in km.
     */
    SpatialMatch nearest(double lon, double lat);

    /**
     * Number of points searched.
     */
    int size();
}
