package com.williamcallahan.facesearch.web;

import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.MatchResult;
import com.williamcallahan.facesearch.service.MatchSearchService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Face search over the registered partner photos.
 */
@RestController
@RequestMapping("/api/face-search")
public class FaceSearchController extends BaseController {

    private final MatchSearchService matchSearchService;

    public FaceSearchController(MatchSearchService matchSearchService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.matchSearchService = matchSearchService;
    }

    /**
     * Returns the entities whose photo matches the query image.
     *
     * <p>An empty list is returned both for "no match" and for "no active provider";
     * {@code GET /api/face-providers/active} tells the two apart.</p>
     */
    @PostMapping
    public ResponseEntity<ApiResponse> search(@Valid @RequestBody FaceSearchRequest request) {
        List<MatchResult> matches = matchSearchService.search(ImageSource.parse(request.image()), request.threshold());
        return ResponseEntity.ok(FaceSearchResponse.success(matches));
    }
}
