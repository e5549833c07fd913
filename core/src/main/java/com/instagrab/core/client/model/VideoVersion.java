package com.instagrab.core.client.model;

public record VideoVersion(String url, int width, int height, int type) implements SizedAsset {
}
