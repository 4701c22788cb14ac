package com.lennon.idcard.mojo;

import com.lennon.idcard.fake.FakeOptions;
import com.lennon.idcard.fake.GenerationException;
import com.lennon.idcard.model.Gender;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

@Mojo(name = "fake", requiresProject = false)
public class FakeMojo extends BaseMojo {

    @Parameter(property = "region")
    protected String region; // 2..6 位区划前缀

    @Parameter(property = "minYear")
    protected Integer minYear;

    @Parameter(property = "maxYear")
    protected Integer maxYear;

    @Parameter(property = "gender") // male | female
    protected String gender;

    @Parameter(property = "count", defaultValue = "1")
    protected int count;

    @Override
    public void execute() throws MojoFailureException {
        initService();
        FakeOptions opts = buildOptions();
        getLog().debug("Generating " + count + " number(s) with " + opts);

        try {
            for (int i = 0; i < count; i++) {
                String out = service.fake(opts);
                getLog().info("Fake: " + out);
                System.out.println(out);
            }
        } catch (GenerationException e) {
            throw new MojoFailureException(e.getMessage(), e);
        }
    }

    FakeOptions buildOptions() throws MojoFailureException {
        FakeOptions opts = FakeOptions.none();
        if (region != null && !region.isEmpty()) opts = opts.region(region);
        if (minYear != null) opts = opts.minYear(minYear);
        if (maxYear != null) opts = opts.maxYear(maxYear);
        if (gender != null && !gender.isEmpty()) {
            try {
                opts = opts.gender(Gender.parse(gender));
            } catch (IllegalArgumentException e) {
                throw new MojoFailureException(e.getMessage(), e);
            }
        }
        return opts;
    }
}
