package com.example.jpegtopdf.config;

import com.example.jpegtopdf.domain.model.DocumentConfig;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed configuration for conversion defaults. Request parameters override these values.
 */
@Component
@ConfigurationProperties(prefix = "jpegtopdf")
public class JpegToPdfProperties {

    private double defaultDpi = DocumentConfig.DEFAULT_DPI;
    private boolean stripExif = false;
    private String defaultTitle = "";
    private String downloadFileName = "images.pdf";

    /**
     * Returns the resolution used when a request does not name one.
     */
    public double getDefaultDpi() {
        return defaultDpi;
    }

    public void setDefaultDpi(double defaultDpi) {
        this.defaultDpi = defaultDpi;
    }

    /**
     * Indicates if EXIF segments are removed from embedded images by default.
     */
    public boolean isStripExif() {
        return stripExif;
    }

    public void setStripExif(boolean stripExif) {
        this.stripExif = stripExif;
    }

    public String getDefaultTitle() {
        return defaultTitle;
    }

    public void setDefaultTitle(String defaultTitle) {
        this.defaultTitle = defaultTitle;
    }

    /**
     * Returns the file name suggested to browsers for the generated PDF.
     */
    public String getDownloadFileName() {
        return downloadFileName;
    }

    public void setDownloadFileName(String downloadFileName) {
        this.downloadFileName = downloadFileName;
    }
}
