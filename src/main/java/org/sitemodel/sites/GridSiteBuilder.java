package org.sitemodel.sites;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrays;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces contributing coordinates by the centers of the grid cells they fall in.
 */
@UtilityClass
final class GridSiteBuilder {

    /**
     * Result of gridding: the lattice used and one site per non-empty cell.
     */
    record GriddedSites(GridSpec grid, List<TargetSite> sites) {
    }

    static GriddedSites build(SiteSources sources, double spacingKm) {
        double[] lonLat = packCoordinates(sources);
        GridSpec grid = GridSpec.covering(spacingKm, CoordinateExtent.of(lonLat));

        Long2IntOpenHashMap occupancy = new Long2IntOpenHashMap();
        for (int i = 0; i < lonLat.length; i += 2) {
            long cell = grid.cellIndex(grid.rowOf(lonLat[i + 1]), grid.columnOf(lonLat[i]));
            occupancy.addTo(cell, 1);
        }

        long[] cells = occupancy.keySet().toLongArray();
        LongArrays.quickSort(cells);

        List<TargetSite> sites = new ArrayList<>(cells.length);
        for (long cell : cells) {
            sites.add(new TargetSite(
                    Long.toString(cell),
                    grid.centerLon(grid.columnOfCell(cell)),
                    grid.centerLat(grid.rowOfCell(cell))
            ));
        }
        return new GriddedSites(grid, sites);
    }

    private static double[] packCoordinates(SiteSources sources) {
        double[] lonLat = new double[sources.coordinateCount() * 2];
        int offset = 0;
        for (SiteCoordinate site : sources.getExplicitSites()) {
            lonLat[offset++] = site.getLongitude();
            lonLat[offset++] = site.getLatitude();
        }
        for (AssetLocation asset : sources.getAssetLocations()) {
            lonLat[offset++] = asset.getLongitude();
            lonLat[offset++] = asset.getLatitude();
        }
        return lonLat;
    }
}
