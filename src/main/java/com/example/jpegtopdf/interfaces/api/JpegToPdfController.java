package com.example.jpegtopdf.interfaces.api;

import com.example.jpegtopdf.application.exception.ApplicationException;
import com.example.jpegtopdf.application.service.JpegToPdfService;
import com.example.jpegtopdf.config.JpegToPdfProperties;
import com.example.jpegtopdf.domain.exception.DomainException;
import com.example.jpegtopdf.infrastructure.exception.InfrastructureException;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Interfaces-layer MVC controller that handles JPEG uploads and returns the generated PDF.
 */
@Controller
public class JpegToPdfController {

    private static final String UPLOAD_VIEW = "upload";

    private final JpegToPdfService jpegToPdfService;
    private final JpegToPdfProperties properties;

    /**
     * Creates the controller with the conversion service and configured defaults.
     *
     * @param jpegToPdfService service responsible for building PDFs
     * @param properties       defaults shown on the upload form
     */
    public JpegToPdfController(JpegToPdfService jpegToPdfService, JpegToPdfProperties properties) {
        this.jpegToPdfService = jpegToPdfService;
        this.properties = properties;
    }

    /**
     * Renders the upload page pre-filled with the configured defaults.
     *
     * @param model model used to expose attributes to the Thymeleaf view
     * @return upload view name
     */
    @GetMapping("/")
    public String showUploadForm(Model model) {
        populateForm(model, null);
        return UPLOAD_VIEW;
    }

    /**
     * Handles form submissions. Returns the PDF as a download, or the form again with an error message.
     *
     * @param files     uploaded JPEGs in page order
     * @param dpi       requested resolution (optional)
     * @param stripExif whether to strip EXIF (optional)
     * @param title     document title (optional)
     * @param model     model used for view rendering on failure
     * @return PDF response entity or the upload view name
     */
    @PostMapping("/convert")
    public Object handleUpload(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                               @RequestParam(value = "dpi", required = false) Double dpi,
                               @RequestParam(value = "stripExif", required = false) Boolean stripExif,
                               @RequestParam(value = "title", required = false) String title,
                               Model model) {
        try {
            byte[] pdf = jpegToPdfService.convert(files, dpi, stripExif, title);
            return pdfResponse(pdf);
        } catch (DomainException | ApplicationException ex) {
            populateForm(model, ex.getMessage());
        } catch (InfrastructureException ex) {
            populateForm(model, "We couldn't read those images. Please try again.");
        }
        return UPLOAD_VIEW;
    }

    /**
     * REST endpoint that mirrors the HTML upload form but always answers with PDF bytes or a JSON error.
     *
     * @param files     uploaded JPEGs in page order
     * @param dpi       requested resolution (optional)
     * @param stripExif whether to strip EXIF (optional)
     * @param title     document title (optional)
     * @return PDF document
     */
    @PostMapping("/api/convert")
    @ResponseBody
    public ResponseEntity<byte[]> handleUploadApi(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                                                  @RequestParam(value = "dpi", required = false) Double dpi,
                                                  @RequestParam(value = "stripExif", required = false) Boolean stripExif,
                                                  @RequestParam(value = "title", required = false) String title) {
        byte[] pdf = jpegToPdfService.convert(files, dpi, stripExif, title);
        return pdfResponse(pdf);
    }

    private ResponseEntity<byte[]> pdfResponse(byte[] pdf) {
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(jpegToPdfService.downloadFileName())
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }

    private void populateForm(Model model, String error) {
        model.addAttribute("defaultDpi", properties.getDefaultDpi());
        model.addAttribute("stripExif", properties.isStripExif());
        model.addAttribute("error", error);
    }
}
