package com.instagrab.core.client.model;

public record ImageCandidate(String url, int width, int height) implements SizedAsset {
}
