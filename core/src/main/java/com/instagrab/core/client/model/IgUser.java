package com.instagrab.core.client.model;

import com.google.gson.annotations.SerializedName;

public record IgUser(
        @SerializedName(value = "pk", alternate = {"id"}) String pk,
        String username,
        @SerializedName("full_name") String fullName,
        @SerializedName("is_private") boolean isPrivate
) {
}
