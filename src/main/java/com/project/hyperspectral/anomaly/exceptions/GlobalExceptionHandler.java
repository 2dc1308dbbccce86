package com.project.hyperspectral.anomaly.exceptions;

import com.project.hyperspectral.anomaly.DTOs.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import org.springframework.web.servlet.view.json.MappingJackson2JsonView;

import java.io.IOException;
import java.util.Map;

/**
 * Turns request failures into a response for whichever surface the caller used: a JSON
 * {@code {"error": "..."}} body under {@code /api/}, the upload form with a message otherwise.
 * <p>
 * Several of these are raised before any controller is chosen (wrong method, wrong content
 * type), so the surface is decided from the request path rather than the handler.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String API_PREFIX = "/api/";

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ModelAndView handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return errorView(request, HttpStatus.PAYLOAD_TOO_LARGE,
                "Image too large", "The file is too large. Maximum size: 10MB");
    }

    @ExceptionHandler({HttpMediaTypeNotSupportedException.class, MultipartException.class})
    public ModelAndView handleMissingUpload(Exception ex, HttpServletRequest request) {
        log.warn("Request to {} carried no readable upload: {}", request.getRequestURI(), ex.getMessage());
        return errorView(request, HttpStatus.BAD_REQUEST,
                "No image provided", "Please upload an image first.");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ModelAndView handleMethodNotSupported(HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        log.warn("{} not supported on {}", ex.getMethod(), request.getRequestURI());
        String message = "Method " + ex.getMethod() + " not allowed";
        return errorView(request, HttpStatus.METHOD_NOT_ALLOWED, message, message);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ModelAndView handleNotFound(NoResourceFoundException ex, HttpServletRequest request) {
        log.debug("No handler for {}", request.getRequestURI());
        return errorView(request, HttpStatus.NOT_FOUND, "Not found", "Page not found.");
    }

    @ExceptionHandler(IOException.class)
    public ModelAndView handleIOException(IOException ex, HttpServletRequest request) {
        log.error("IO error occurred", ex);
        return errorView(request, HttpStatus.INTERNAL_SERVER_ERROR,
                "Could not read the uploaded image", "Could not read the uploaded file. Please try again.");
    }

    @ExceptionHandler(Exception.class)
    public ModelAndView handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error occurred", ex);
        return errorView(request, HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorCategory.INTERNAL_ERROR.callerMessage(null), "An unexpected error occurred. Please try again.");
    }

    private static ModelAndView errorView(HttpServletRequest request, HttpStatus status,
                                          String apiMessage, String pageMessage) {
        if (isApiRequest(request)) {
            MappingJackson2JsonView json = new MappingJackson2JsonView();
            json.setExtractValueFromSingleKeyModel(true);
            ModelAndView mav = new ModelAndView(json, "error", new ErrorResponse(apiMessage));
            mav.setStatus(status);
            return mav;
        }
        return new ModelAndView("index", Map.of("error", pageMessage), status);
    }

    private static boolean isApiRequest(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.startsWith(API_PREFIX);
    }
}
