package org.showvault.service.show;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.showvault.config.AppProperties;
import org.showvault.config.TaskExecutorConfig;
import org.showvault.exception.ApiError;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Checks a show location on a separate thread so a hung network mount cannot stall the request.
 */
@Slf4j
@Component
public class LocationValidator {

    private final AsyncTaskExecutor locationCheckExecutor;
    private final AppProperties appProperties;

    public LocationValidator(@Qualifier(TaskExecutorConfig.LOCATION_CHECK_EXECUTOR) AsyncTaskExecutor locationCheckExecutor,
                             AppProperties appProperties) {
        this.locationCheckExecutor = locationCheckExecutor;
        this.appProperties = appProperties;
    }

    public Path requireWritableDirectory(String location) {
        if (StringUtils.isBlank(location)) {
            throw ApiError.INVALID_LOCATION.createException("<empty>");
        }
        Path path;
        try {
            path = Path.of(location.trim());
        } catch (InvalidPathException e) {
            throw ApiError.INVALID_LOCATION.createException(location);
        }
        if (!path.isAbsolute()) {
            throw ApiError.INVALID_LOCATION.createException(location);
        }

        long timeoutMillis = appProperties.getShows().getLocationCheckTimeout().toMillis();
        Future<Boolean> check;
        try {
            check = locationCheckExecutor.submit(() -> isWritableDirectory(path));
        } catch (TaskRejectedException e) {
            log.error("Location check for {} was rejected, checker pool is saturated", path);
            throw ApiError.LOCATION_CHECK_TIMEOUT.createException(path.toString());
        }
        try {
            if (!check.get(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Show location not accessible: {}", path);
                throw ApiError.INVALID_LOCATION.createException(path.toString());
            }
            return path;
        } catch (TimeoutException e) {
            check.cancel(true);
            log.error("Location check for {} did not finish within {} ms", path, timeoutMillis);
            throw ApiError.LOCATION_CHECK_TIMEOUT.createException(path.toString());
        } catch (ExecutionException e) {
            log.warn("Location check for {} failed: {}", path, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            throw ApiError.INVALID_LOCATION.createException(path.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ApiError.LOCATION_CHECK_TIMEOUT.createException(path.toString());
        }
    }

    static boolean isWritableDirectory(Path path) {
        return Files.exists(path) && Files.isDirectory(path) && Files.isWritable(path);
    }
}
