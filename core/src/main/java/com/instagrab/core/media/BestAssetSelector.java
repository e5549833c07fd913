package com.instagrab.core.media;

import com.instagrab.core.client.model.SizedAsset;

import java.util.List;
import java.util.Optional;

/**
 * Picks the rendition with the largest pixel area; the first of several equal maxima wins.
 */
public final class BestAssetSelector {

    private BestAssetSelector() {
    }

    public static <A extends SizedAsset> Optional<A> best(List<A> assets) {
        if (assets == null) return Optional.empty();
        A best = null;
        for (A asset : assets) {
            if (asset == null || asset.url() == null || asset.url().isEmpty()) continue;
            if (best == null || asset.resolution() > best.resolution()) {
                best = asset;
            }
        }
        return Optional.ofNullable(best);
    }
}
