package com.project.coronal.tracking.controller;

import com.project.coronal.tracking.DTOs.TrackerSnapshot;
import com.project.coronal.tracking.service.CoronalHoleTrackingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Home page with the tracker's current state.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final CoronalHoleTrackingService trackingService;

    public HomeController(CoronalHoleTrackingService trackingService) {
        this.trackingService = trackingService;
    }

    @GetMapping("/")
    public String index(Model model) {
        TrackerSnapshot snapshot = trackingService.snapshot();
        model.addAttribute("state", snapshot.state());
        model.addAttribute("frameCount", snapshot.frameCount());
        model.addAttribute("issuedIdentities", snapshot.issuedIdentities());
        log.debug("Serving home page ({} frames tracked)", snapshot.frameCount());
        return "index"; // templates/index.html
    }
}
