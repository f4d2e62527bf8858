package com.bmsedge.cbcr.controller;

import com.bmsedge.cbcr.config.ConverterProperties;
import com.bmsedge.cbcr.dto.ConversionResponse;
import com.bmsedge.cbcr.dto.ConversionResult;
import com.bmsedge.cbcr.dto.ValidationReport;
import com.bmsedge.cbcr.exception.WorkbookParseException;
import com.bmsedge.cbcr.model.SheetClassification;
import com.bmsedge.cbcr.model.WorkbookData;
import com.bmsedge.cbcr.service.ReportConversionService;
import com.bmsedge.cbcr.service.SchemaValidationService;
import com.bmsedge.cbcr.service.SectionExtractionService;
import com.bmsedge.cbcr.service.TemplateDownloadService;
import com.bmsedge.cbcr.service.WorkbookReaderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upload endpoints for the country-by-country report converter.
 */
@RestController
@RequestMapping("/api/cbcr")
@CrossOrigin(origins = "*", maxAge = 3600)
public class ReportConversionController {

    private static final Logger logger = LoggerFactory.getLogger(ReportConversionController.class);

    static final MediaType APPLICATION_XHTML = MediaType.parseMediaType("application/xhtml+xml");

    private final ReportConversionService reportConversionService;
    private final WorkbookReaderService workbookReaderService;
    private final SchemaValidationService schemaValidationService;
    private final SectionExtractionService sectionExtractionService;
    private final TemplateDownloadService templateDownloadService;
    private final ConverterProperties properties;

    public ReportConversionController(ReportConversionService reportConversionService,
                                      WorkbookReaderService workbookReaderService,
                                      SchemaValidationService schemaValidationService,
                                      SectionExtractionService sectionExtractionService,
                                      TemplateDownloadService templateDownloadService,
                                      ConverterProperties properties) {
        this.reportConversionService = reportConversionService;
        this.workbookReaderService = workbookReaderService;
        this.schemaValidationService = schemaValidationService;
        this.sectionExtractionService = sectionExtractionService;
        this.templateDownloadService = templateDownloadService;
        this.properties = properties;
    }

    /**
     * Convert an Excel workbook into an iXBRL report
     * POST /api/cbcr/convert
     */
    @PostMapping("/convert")
    public ResponseEntity<?> convert(@RequestParam("file") MultipartFile file) {
        logger.info("Conversion request received: file={}, size={} KB",
                file.getOriginalFilename(), file.getSize() / 1024);

        ConversionResult result = reportConversionService.convertUpload(file);

        if (!result.isSuccess()) {
            logger.warn("Conversion rejected: {}", result.getErrors());
            ConversionResponse response = new ConversionResponse(false,
                    "The uploaded workbook could not be converted", result.getErrors());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
        }

        byte[] document = result.getDocument().getBytes(StandardCharsets.UTF_8);
        String filename = reportConversionService.downloadFileName();

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(APPLICATION_XHTML)
                .contentLength(document.length)
                .body(new ByteArrayResource(document));
    }

    /**
     * Check a workbook's structure without generating a report
     * POST /api/cbcr/validate
     */
    @PostMapping("/validate")
    public ResponseEntity<ConversionResponse> validate(@RequestParam("file") MultipartFile file) {
        reportConversionService.checkUpload(file);

        WorkbookData workbook;
        try {
            workbook = workbookReaderService.read(file);
        } catch (WorkbookParseException e) {
            logger.error("Could not read '{}': {}", file.getOriginalFilename(), e.getMessage(), e);
            ConversionResponse response = new ConversionResponse(false, "Error processing file",
                    List.of("Error processing file: " + e.getMessage()));
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
        }

        ValidationReport report = schemaValidationService.validate(workbook);
        SheetClassification classification = sectionExtractionService.classifySheets(workbook);

        Map<String, String> sheets = new LinkedHashMap<>();
        classification.getRolesBySheet().forEach((name, role) -> sheets.put(name, role.name()));

        ConversionResponse response = new ConversionResponse(report.isValid(),
                report.isValid() ? "Workbook is valid" : "Workbook is missing required content",
                report.getMessages());
        response.setSheets(sheets);
        response.setFileName(file.getOriginalFilename());

        HttpStatus status = report.isValid() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(response);
    }

    /**
     * What an upload must contain
     * GET /api/cbcr/requirements
     */
    @GetMapping("/requirements")
    public ResponseEntity<Map<String, Object>> getRequirements() {
        Map<String, Object> requirements = new LinkedHashMap<>();
        requirements.put("requiredSections", SchemaValidationService.REQUIRED_SECTIONS);
        requirements.put("generalInformationFields", SchemaValidationService.REQUIRED_GENERAL_INFO_FIELDS);
        requirements.put("countryOverviewFields", SchemaValidationService.REQUIRED_COUNTRY_FIELDS);
        requirements.put("subsidiaryColumns", List.of(
                "Tax Jurisdiction", "Country Code", "Subsidiary Name", "Nature of Activities"));
        requirements.put("allowedExtensions", properties.getAllowedExtensions());
        requirements.put("maxFileSizeMb", properties.getMaxFileSize().toMegabytes());
        return ResponseEntity.ok(requirements);
    }

    /**
     * Download the Excel input template
     * GET /api/cbcr/template
     */
    @GetMapping("/template")
    public ResponseEntity<ByteArrayResource> downloadTemplate(
            @RequestParam(defaultValue = "false") boolean includeSampleData) throws IOException {

        logger.info("Generating report template, includeSampleData={}", includeSampleData);
        byte[] excelBytes = templateDownloadService.generateReportTemplate(includeSampleData);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"country_by_country_report_template.xlsx\"")
                .contentType(MediaType.parseMediaType(
                        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"))
                .contentLength(excelBytes.length)
                .body(new ByteArrayResource(excelBytes));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "OK");
        response.put("message", "Country-by-country report converter is running");
        response.put("endpoints", new String[]{
                "POST /api/cbcr/convert - Convert workbook to iXBRL report",
                "POST /api/cbcr/validate - Validate workbook structure",
                "GET /api/cbcr/requirements - Required sheets and fields",
                "GET /api/cbcr/template - Download Excel input template"
        });
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(response);
    }
}
