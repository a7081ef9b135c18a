package com.project.coronal.tracking.controller;

import com.project.coronal.tracking.DTOs.TrackedContourView;
import com.project.coronal.tracking.DTOs.TrackerSnapshot;
import com.project.coronal.tracking.DTOs.TrackingResult;
import com.project.coronal.tracking.exceptions.TrackingException;
import com.project.coronal.tracking.model.Raster;
import com.project.coronal.tracking.service.BoundaryExtractor;
import com.project.coronal.tracking.service.CoronalHoleTrackingService;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import javax.imageio.ImageIO;

/**
 * Accepts corrected longitude/latitude rasters one at a time and feeds them to the
 * tracker. The JSON snapshot is the hand-off point for map building.
 */
@Controller
@Validated
public class TrackingController {
    private static final Logger log = LoggerFactory.getLogger(TrackingController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/png", "image/gif", "image/bmp", "image/jpeg", "image/jpg", "image/tiff"
    );

    private final CoronalHoleTrackingService trackingService;
    private final BoundaryExtractor boundaryExtractor;

    @Value("${app.tracking.min-image-size:16}")
    private int minImageSize;

    @Value("${app.tracking.max-image-size:4000}")
    private int maxImageSize;

    public TrackingController(CoronalHoleTrackingService trackingService, BoundaryExtractor boundaryExtractor) {
        this.trackingService = trackingService;
        this.boundaryExtractor = boundaryExtractor;
    }

    @GetMapping("/track")
    public String showForm(Model model) {
        populateFormModel(model);
        return "track";
    }

    @PostMapping(value = "/track", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "timestamp", required = false) String timestamp,
            Model model
    ) throws IOException {
        validateUploadedFile(file);
        Instant observedAt = parseTimestamp(timestamp);

        log.info("Tracking file: {} ({}KB) observed at {}", file.getOriginalFilename(), file.getSize() / 1024, observedAt);

        BufferedImage input = loadAndValidateImage(file);
        TrackingResult result = trackingService.process(Raster.fromImage(input), observedAt);

        List<TrackedContourView> contours = result.frame().getContours().stream()
                .map(TrackedContourView::of)
                .toList();

        model.addAttribute("frameNumber", result.frameNumber());
        model.addAttribute("observedAt", observedAt);
        model.addAttribute("width", input.getWidth());
        model.addAttribute("height", input.getHeight());
        model.addAttribute("contours", contours);
        model.addAttribute("matched", result.matches().size());
        model.addAttribute("newIdentities", result.newIdentities());
        log.info("Frame {} tracked: {} coronal holes", result.frameNumber(), contours.size());
        return "result";
    }

    @PostMapping("/track/reset")
    public String reset() {
        trackingService.reset();
        log.info("Tracker reset on request");
        return "redirect:/track";
    }

    @GetMapping(value = "/api/tracker", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public TrackerSnapshot snapshot() {
        return trackingService.snapshot();
    }

    private void populateFormModel(Model model) {
        model.addAttribute("binaryThreshold", boundaryExtractor.getBinaryThreshold());
        model.addAttribute("areaThreshold", boundaryExtractor.getAreaThreshold());
        model.addAttribute("frameCount", trackingService.getFrameCount());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a raster to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException("Unsupported file format: " + contentType
                    + ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS));
        }
    }

    private Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return Instant.now();
        }
        try {
            return Instant.parse(timestamp.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Timestamp must be ISO-8601, e.g. 2011-04-01T00:00:00Z: " + timestamp);
        }
    }

    private BufferedImage loadAndValidateImage(MultipartFile file) throws IOException {
        BufferedImage input;
        try (var inputStream = file.getInputStream()) {
            input = ImageIO.read(inputStream);
        }
        if (input == null) {
            throw new TrackingException("The file is not a readable image.");
        }
        if (input.getWidth() < minImageSize || input.getHeight() < minImageSize) {
            throw new TrackingException("Raster too small. Minimum size: " + minImageSize + "x" + minImageSize + " pixels");
        }
        if (input.getWidth() > maxImageSize || input.getHeight() > maxImageSize) {
            throw new TrackingException("Raster too large. Maximum size: " + maxImageSize + "x" + maxImageSize + " pixels");
        }
        log.debug("Raster loaded: {}x{}", input.getWidth(), input.getHeight());
        return input;
    }
}
