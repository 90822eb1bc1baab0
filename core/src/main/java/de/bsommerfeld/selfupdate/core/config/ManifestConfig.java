package de.bsommerfeld.selfupdate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Location of the release manifest. The manifest is a small JSON document
 * describing the latest published release.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ManifestConfig {

    static final String DEFAULT_URL =
            "https://raw.githubusercontent.com/imadalloune/condor-qc-updates/main/version.json";

    @JsonProperty("url")
    private String url = DEFAULT_URL;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }
}
