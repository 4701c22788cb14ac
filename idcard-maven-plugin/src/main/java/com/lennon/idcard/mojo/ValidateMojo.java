package com.lennon.idcard.mojo;

import com.lennon.idcard.cn.Identity;
import com.lennon.idcard.validate.ValidationResult;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

@Mojo(name = "validate", requiresProject = false)
public class ValidateMojo extends BaseMojo {

    /** Fail the build when the number is invalid. */
    @Parameter(property = "failOnInvalid", defaultValue = "false")
    protected boolean failOnInvalid;

    @Override
    public void execute() throws MojoFailureException {
        initService();

        if (!hasText()) {
            getLog().info("No -Dtext provided, nothing to validate.");
            return;
        }
        ValidationResult result = service.check(text);
        getLog().info("Result: " + result);
        if (result.identity().isPresent()) {
            Identity id = result.identity().get();
            getLog().info("Number:   " + id.number());
            getLog().info("Birth:    " + id.birthDateText().orElse("-"));
            getLog().info("Gender:   " + id.gender().map(Enum::name).orElse("-"));
            getLog().info("Province: " + id.province().orElse("-"));
            getLog().info("Region:   " + id.region().orElse("-"));
        }
        System.out.println(result.isValid());

        if (!result.isValid() && failOnInvalid) {
            throw new MojoFailureException("Invalid number " + text + ": "
                    + result.error().map(Enum::name).orElse("UNKNOWN"));
        }
    }
}
