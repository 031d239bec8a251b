package com.williamcallahan.facesearch.web;

import com.williamcallahan.facesearch.domain.RegenerationScope;
import com.williamcallahan.facesearch.service.DescriptorRegenerationJob;
import com.williamcallahan.facesearch.service.DescriptorRegistrationService;
import com.williamcallahan.facesearch.service.EmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registration, removal and regeneration of stored face descriptors.
 */
@RestController
@RequestMapping("/api/face-embeddings")
public class FaceEmbeddingController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(FaceEmbeddingController.class);

    private final DescriptorRegistrationService registrationService;
    private final DescriptorRegenerationJob regenerationJob;
    private final EmbeddingStore embeddingStore;

    public FaceEmbeddingController(
            DescriptorRegistrationService registrationService,
            DescriptorRegenerationJob regenerationJob,
            EmbeddingStore embeddingStore,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.registrationService = registrationService;
        this.regenerationJob = regenerationJob;
        this.embeddingStore = embeddingStore;
    }

    /**
     * Lists records still waiting for a descriptor.
     */
    @GetMapping("/pending")
    public ResponseEntity<ApiResponse> listPending() {
        return ResponseEntity.ok(PendingDescriptorsResponse.from(embeddingStore.listNeedingDescriptor()));
    }

    /**
     * Re-runs extraction for the corpus.
     */
    @PostMapping("/regenerate")
    public ResponseEntity<ApiResponse> regenerate(
            @RequestParam(name = "scope", defaultValue = "NEEDING_DESCRIPTOR") RegenerationScope scope) {
        log.info("[FACE-REGENERATION] Regeneration requested for scope {}", scope);
        return ResponseEntity.ok(RegenerationResponse.from(regenerationJob.run(scope)));
    }

    /**
     * Extracts and stores the descriptor for one entity photo.
     */
    @PostMapping("/{entityId}")
    public ResponseEntity<ApiResponse> register(@PathVariable("entityId") String entityId) {
        return ResponseEntity.ok(RegistrationResponse.from(registrationService.register(entityId)));
    }

    /**
     * Removes the stored descriptor for one entity.
     */
    @DeleteMapping("/{entityId}")
    public ResponseEntity<ApiResponse> remove(@PathVariable("entityId") String entityId) {
        if (!registrationService.remove(entityId)) {
            return handleNotFound("No face descriptor stored for " + entityId);
        }
        return createSuccessResponse("Removed face descriptor for " + entityId);
    }
}
