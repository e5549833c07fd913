package com.instagrab.core.client.model;

import java.util.List;

/**
 * A user's current story reel, or a highlight reel (id prefixed with "highlight:").
 */
public record StoryReel(String id, IgUser user, List<RawPost> items) {

    public List<RawPost> itemsOrEmpty() {
        return items != null ? items : List.of();
    }
}
