package com.williamcallahan.facesearch.logging;

import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.RegenerationReport;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs each stage of the match pipeline with a request id and its duration.
 */
@Aspect
@Component
public class MatchPipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private static final AtomicLong REQUEST_SEQUENCE = new AtomicLong();

    // Set only while a search or regeneration runs on this thread; pool threads never inherit it
    private static final ThreadLocal<String> REQUEST_ID = new ThreadLocal<>();

    /**
     * Log face search
     */
    @Around("execution(* com.williamcallahan.facesearch.service.MatchSearchService.search(..))")
    public Object logSearch(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = nextRequestId();
        REQUEST_ID.set(requestId);
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] FACE SEARCH - Starting", requestId);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof List<?> matches) {
                PIPELINE_LOG.info("[{}] FACE SEARCH - {} matches in {}ms", requestId, matches.size(), duration);
            }

            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] FACE SEARCH - Failed: {}", requestId, e.getMessage());
            throw e;
        } finally {
            REQUEST_ID.remove();
        }
    }

    /**
     * Log descriptor extraction
     */
    @Around("execution(* com.williamcallahan.facesearch.service.recognition.RecognitionBackends.extract(..))")
    public Object logExtraction(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = currentRequestId().orElseGet(MatchPipelineLogger::nextRequestId);
        long startTime = System.currentTimeMillis();

        Object result = joinPoint.proceed();
        long duration = System.currentTimeMillis() - startTime;

        if (result instanceof ExtractionOutcome.Unavailable unavailable) {
            PIPELINE_LOG.debug("[{}] EXTRACTION - Unavailable ({}) after {}ms",
                requestId, unavailable.category(), duration);
        } else {
            PIPELINE_LOG.debug("[{}] EXTRACTION - Completed in {}ms", requestId, duration);
        }
        return result;
    }

    /**
     * Log regeneration runs
     */
    @Around("execution(* com.williamcallahan.facesearch.service.DescriptorRegenerationJob.run(..))")
    public Object logRegeneration(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = nextRequestId();
        REQUEST_ID.set(requestId);
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] REGENERATION - Starting scope {}", requestId, joinPoint.getArgs()[0]);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof RegenerationReport report) {
                PIPELINE_LOG.info("[{}] REGENERATION - {}/{} succeeded in {}ms",
                    requestId, report.success(), report.total(), duration);
            }

            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] REGENERATION - Failed: {}", requestId, e.getMessage());
            throw e;
        } finally {
            REQUEST_ID.remove();
        }
    }

    static Optional<String> currentRequestId() {
        return Optional.ofNullable(REQUEST_ID.get());
    }

    private static String nextRequestId() {
        return "REQ-" + System.currentTimeMillis() + "-" + REQUEST_SEQUENCE.incrementAndGet();
    }
}
