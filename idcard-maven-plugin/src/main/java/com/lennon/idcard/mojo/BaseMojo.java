package com.lennon.idcard.mojo;

import com.lennon.idcard.core.IdCardService;
import com.lennon.idcard.core.IdCardServices;
import com.lennon.idcard.spi.SeededRandomSource;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugins.annotations.Parameter;

public abstract class BaseMojo extends AbstractMojo {

    static final String SEED_ENV = "IDCARD_SEED_HEX";

    @Parameter(property = "text")
    protected String text;

    /** Hex seed for reproducible fake numbers; falls back to IDCARD_SEED_HEX. */
    @Parameter(property = "seedHex")
    protected String seedHex;

    protected IdCardService service;

    protected void initService() {
        String hex = seedHex;
        if (hex == null || hex.isEmpty()) {
            // 尝试系统属性 / 环境变量
            hex = System.getProperty(SEED_ENV);
            if (hex == null || hex.isEmpty()) hex = System.getenv(SEED_ENV);
        }
        if (hex == null || hex.isEmpty()) {
            service = IdCardServices.build();
        } else {
            getLog().debug("Using seeded random source");
            service = IdCardServices.seeded(SeededRandomSource.hexToBytes(hex));
        }
    }

    protected boolean hasText() {
        return text != null && !text.trim().isEmpty();
    }
}
