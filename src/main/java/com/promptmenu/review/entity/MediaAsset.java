package com.promptmenu.review.entity;

/**
 * 리뷰 첨부 영상/음성. 빈 골격은 url="", duration=0.
 */
public record MediaAsset(String url, int duration, String contentType, String uploadDate) {

    public static MediaAsset empty() {
        return new MediaAsset("", 0, "", "");
    }
}
