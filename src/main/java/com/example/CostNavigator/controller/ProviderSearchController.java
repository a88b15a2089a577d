package com.example.CostNavigator.controller;

import com.example.CostNavigator.model.ProviderResult;
import com.example.CostNavigator.model.ProviderSearchRequest;
import com.example.CostNavigator.service.NavigatorService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ProviderSearchController {

    private final NavigatorService navigatorService;

    /**
     * Example:
     *   GET /api/providers?drg=470&zip=10001&radius_km=25&sort=cheapest
     *   GET /api/providers?drg=knee%20replacement&zip=10001
     */
    @GetMapping("/providers")
    public List<ProviderResult> providers(
            @RequestParam(value = "drg", required = false) String drg,
            @RequestParam(value = "zip", required = false) String zip,
            @RequestParam(value = "radius_km", required = false) Double radiusKm,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "sort", required = false) String sort
    ) {
        return navigatorService.search(new ProviderSearchRequest(drg, zip, radiusKm, limit, sort));
    }
}
