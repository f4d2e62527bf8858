package com.bmsedge.cbcr.service;

import com.bmsedge.cbcr.config.ConverterProperties;
import com.bmsedge.cbcr.dto.ConversionResult;
import com.bmsedge.cbcr.dto.ValidationReport;
import com.bmsedge.cbcr.exception.InvalidUploadException;
import com.bmsedge.cbcr.exception.WorkbookParseException;
import com.bmsedge.cbcr.model.WorkbookData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Entry point of the conversion pipeline: workbook in, complete document or
 * list of validation errors out.
 */
@Service
public class ReportConversionService {

    private static final Logger logger = LoggerFactory.getLogger(ReportConversionService.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final WorkbookReaderService workbookReaderService;
    private final SchemaValidationService schemaValidationService;
    private final ReportRenderingService reportRenderingService;
    private final ConverterProperties properties;
    private final Clock clock;

    public ReportConversionService(WorkbookReaderService workbookReaderService,
                                   SchemaValidationService schemaValidationService,
                                   ReportRenderingService reportRenderingService,
                                   ConverterProperties properties,
                                   Clock clock) {
        this.workbookReaderService = workbookReaderService;
        this.schemaValidationService = schemaValidationService;
        this.reportRenderingService = reportRenderingService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Validate and render an already parsed workbook. Validation errors are
     * collected eagerly, except that missing sections suppress field checks.
     */
    public ConversionResult convert(WorkbookData workbook) {
        ValidationReport report = schemaValidationService.validate(workbook);
        if (!report.isValid()) {
            return ConversionResult.failure(report.getMessages());
        }

        try {
            return ConversionResult.success(reportRenderingService.render(workbook));
        } catch (RuntimeException e) {
            logger.error("Failed to render report: {}", e.getMessage(), e);
            return ConversionResult.failure("Error processing file: " + e.getMessage());
        }
    }

    /**
     * Check, parse and convert an uploaded file.
     *
     * @throws InvalidUploadException if the upload is rejected before parsing
     */
    public ConversionResult convertUpload(MultipartFile file) {
        checkUpload(file);
        logger.info("Converting '{}' ({} KB)", file.getOriginalFilename(), file.getSize() / 1024);

        WorkbookData workbook;
        try {
            workbook = workbookReaderService.read(file);
        } catch (WorkbookParseException e) {
            logger.error("Could not read '{}': {}", file.getOriginalFilename(), e.getMessage(), e);
            return ConversionResult.failure("Error processing file: " + e.getMessage());
        }

        ConversionResult result = convert(workbook);
        logger.info("Conversion of '{}' finished, success={}", file.getOriginalFilename(), result.isSuccess());
        return result;
    }

    public void checkUpload(MultipartFile file) {
        if (file == null || file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()) {
            throw new InvalidUploadException("No file selected", "NO_FILE");
        }
        if (file.isEmpty()) {
            throw new InvalidUploadException("File is empty", "EMPTY_FILE");
        }
        if (!properties.isAllowedFileName(file.getOriginalFilename())) {
            throw new InvalidUploadException(
                    "Invalid file type. Please upload an Excel file (.xlsx or .xls)", "INVALID_FORMAT");
        }
        if (file.getSize() > properties.getMaxFileSize().toBytes()) {
            throw new InvalidUploadException(
                    "File exceeds the maximum upload size of " + properties.getMaxFileSize().toMegabytes() + "MB",
                    "FILE_TOO_LARGE");
        }
    }

    public String downloadFileName() {
        return "country_by_country_report_" + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + ".xhtml";
    }
}
