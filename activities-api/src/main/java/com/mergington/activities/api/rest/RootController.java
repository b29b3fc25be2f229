package com.mergington.activities.api.rest;

import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Sends browsers to the static landing page.
 */
@Controller
public class RootController {

    @GetMapping("/")
    public String root() {
        return "redirect:/static/index.html";
    }
}
