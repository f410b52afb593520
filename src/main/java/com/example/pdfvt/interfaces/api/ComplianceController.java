package com.example.pdfvt.interfaces.api;

import com.example.pdfvt.application.service.ComplianceReportFormatter;
import com.example.pdfvt.application.service.ComplianceUploadService;
import com.example.pdfvt.domain.exception.DomainException;
import com.example.pdfvt.domain.model.ComplianceResult;
import com.example.pdfvt.domain.model.VersionProfileRegistry;
import com.example.pdfvt.domain.model.VtVariant;
import com.example.pdfvt.infrastructure.exception.InfrastructureException;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

/**
 * Interfaces-layer controller for PDF/VT compliance checks: an HTML upload page plus JSON and text endpoints.
 */
@Controller
public class ComplianceController {

    private final ComplianceUploadService uploadService;
    private final ComplianceReportFormatter formatter;
    private final VersionProfileRegistry registry;

    public ComplianceController(ComplianceUploadService uploadService,
                                ComplianceReportFormatter formatter,
                                VersionProfileRegistry registry) {
        this.uploadService = uploadService;
        this.formatter = formatter;
        this.registry = registry;
    }

	/**
	 * Renders the upload page.
	 *
	 * @param model model exposed to the Thymeleaf view
	 * @return view name
	 */
    @GetMapping("/")
    public String showCheckForm(Model model) {
        model.addAttribute("profiles", registry.all());
        model.addAttribute("report", null);
        model.addAttribute("error", null);
        return "compliance";
    }

	/**
	 * Handles form submissions and renders the text report.
	 *
	 * @param file     uploaded PDF
	 * @param expected optional expected variant
	 * @param model    model used for view rendering
	 * @return view name populated with a report or an error message
	 */
    @PostMapping("/check")
    public String handleCheck(@RequestParam("file") MultipartFile file,
                              @RequestParam(value = "expected", required = false) String expected,
                              Model model) {
        model.addAttribute("profiles", registry.all());
        try {
            VtVariant expectedVariant = parseOptional(expected);
            ComplianceResult result = uploadService.check(file);
            model.addAttribute("result", ComplianceResponse.of(file.getOriginalFilename(), result, expectedVariant));
            model.addAttribute("report", formatter.format(file.getOriginalFilename(), result));
            model.addAttribute("error", null);
        } catch (DomainException ex) {
            model.addAttribute("report", null);
            model.addAttribute("error", ex.getMessage());
        } catch (InfrastructureException ex) {
            model.addAttribute("report", null);
            model.addAttribute("error", "We couldn't read that PDF. Please try another file.");
        }
        return "compliance";
    }

	/**
	 * JSON variant of the check.
	 *
	 * @param file     uploaded PDF
	 * @param expected optional expected variant; when given the response says whether it matched
	 * @return verdict wrapped with the file name
	 */
    @PostMapping(value = "/api/compliance", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<ComplianceResponse> checkApi(@RequestParam("file") MultipartFile file,
                                                       @RequestParam(value = "expected", required = false) String expected) {
        VtVariant expectedVariant = parseOptional(expected);
        ComplianceResult result = uploadService.check(file);
        return ResponseEntity.ok(ComplianceResponse.of(file.getOriginalFilename(), result, expectedVariant));
    }

    @PostMapping(value = "/api/compliance/report", produces = MediaType.TEXT_PLAIN_VALUE)
    @ResponseBody
    public String checkReport(@RequestParam("file") MultipartFile file) {
        ComplianceResult result = uploadService.check(file);
        return formatter.format(file.getOriginalFilename(), result);
    }

    private VtVariant parseOptional(String expected) {
        return expected == null || expected.isBlank() ? null : VtVariant.parse(expected);
    }
}
