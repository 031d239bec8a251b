package com.williamcallahan.facesearch.web;

import com.williamcallahan.facesearch.service.ProviderAdminService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Provider status and selection.
 */
@RestController
@RequestMapping("/api/face-providers")
public class FaceProviderController extends BaseController {

    private final ProviderAdminService providerAdminService;

    public FaceProviderController(ProviderAdminService providerAdminService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.providerAdminService = providerAdminService;
    }

    @GetMapping("/active")
    public ResponseEntity<ApiResponse> activeProvider() {
        return ResponseEntity.ok(ProviderStatusResponse.from(providerAdminService.status()));
    }

    @PostMapping("/{providerId}/activate")
    public ResponseEntity<ApiResponse> activate(@PathVariable("providerId") String providerId) {
        return ResponseEntity.ok(ProviderStatusResponse.from(providerAdminService.activate(providerId)));
    }
}
