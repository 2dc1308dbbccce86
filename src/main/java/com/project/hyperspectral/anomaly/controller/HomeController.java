package com.project.hyperspectral.anomaly.controller;

import com.project.hyperspectral.anomaly.config.DetectionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Upload form. Also tells the user which cube dimensions an analysis will cover, since the
 * uploaded file does not decide them.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final DetectionProperties properties;

    public HomeController(DetectionProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/")
    public String uploadForm(Model model) {
        String shape = properties.getRows() + "x" + properties.getCols() + "x" + properties.getBands();
        log.debug("Serving upload form (cube {})", shape);
        model.addAttribute("cubeShape", shape);
        return "index";
    }
}
