package com.instagrab.core.client;

import com.google.gson.annotations.SerializedName;
import com.instagrab.core.client.model.HighlightRef;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.core.client.model.StoryReel;

import java.util.List;
import java.util.Map;

/**
 * Envelopes of the endpoints the client talks to. Only the fields we read are mapped.
 */
final class ApiResponses {

    private ApiResponses() {
    }

    record WebProfileInfo(Data data) {
        record Data(IgUser user) {
        }
    }

    record UserInfo(IgUser user) {
    }

    record MediaInfo(List<RawPost> items) {
    }

    record Feed(
            List<RawPost> items,
            @SerializedName("more_available") boolean moreAvailable,
            @SerializedName("next_max_id") String nextMaxId
    ) {
    }

    record Saved(
            List<SavedItem> items,
            @SerializedName("more_available") boolean moreAvailable,
            @SerializedName("next_max_id") String nextMaxId
    ) {
        record SavedItem(RawPost media) {
        }
    }

    /** Clips endpoint nests paging info. */
    record Clips(
            List<ClipItem> items,
            @SerializedName("paging_info") PagingInfo pagingInfo
    ) {
        record ClipItem(RawPost media) {
        }

        record PagingInfo(
                @SerializedName("more_available") boolean moreAvailable,
                @SerializedName("max_id") String maxId
        ) {
        }
    }

    record ReelsMedia(
            Map<String, StoryReel> reels,
            @SerializedName("reels_media") List<StoryReel> reelsMedia
    ) {
    }

    record HighlightsTray(List<HighlightRef> tray) {
    }
}
