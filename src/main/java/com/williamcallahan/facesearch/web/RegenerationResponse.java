package com.williamcallahan.facesearch.web;

import com.williamcallahan.facesearch.domain.RegenerationReport;
import java.util.List;

/**
 * Summary of a regeneration run.
 */
public record RegenerationResponse(
        String status, int total, int success, int failed, List<String> errors, boolean interrupted)
        implements ApiResponse {

    public static RegenerationResponse from(RegenerationReport report) {
        return new RegenerationResponse(
                "success", report.total(), report.success(), report.failed(), report.errors(), report.interrupted());
    }
}
