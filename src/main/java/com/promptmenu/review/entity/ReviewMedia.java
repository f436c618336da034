package com.promptmenu.review.entity;

import java.util.List;

public record ReviewMedia(List<String> images, MediaAsset video, MediaAsset audio) {

    public ReviewMedia {
        images = images == null ? List.of() : List.copyOf(images);
        video = video == null ? MediaAsset.empty() : video;
        audio = audio == null ? MediaAsset.empty() : audio;
    }

    public static ReviewMedia empty() {
        return new ReviewMedia(List.of(), MediaAsset.empty(), MediaAsset.empty());
    }
}
