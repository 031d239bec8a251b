package com.williamcallahan.facesearch.web;

import com.williamcallahan.facesearch.domain.MatchResult;
import java.util.List;

/**
 * Matches found for a query photo, best first.
 *
 * @param status fixed "success"
 * @param matches ranked matches, possibly empty
 */
public record FaceSearchResponse(String status, List<MatchResult> matches) implements ApiResponse {

    public static FaceSearchResponse success(List<MatchResult> matches) {
        return new FaceSearchResponse("success", List.copyOf(matches));
    }
}
