package com.lennon.idcard.consumer;

import com.lennon.idcard.cn.Identity;
import com.lennon.idcard.core.IdCardService;
import com.lennon.idcard.core.IdCardServices;
import com.lennon.idcard.fake.FakeOptions;
import com.lennon.idcard.model.Gender;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Consumer view of the library: only the public service API, the way a downstream project uses it.
 */
public class IdCardConsumerDemoTests {
    private static final Logger log = LoggerFactory.getLogger(IdCardConsumerDemoTests.class);

    static IdCardService service;

    @BeforeAll
    static void init() {
        service = IdCardServices.seeded("tenant:test|app:consumer-demo".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void samples_describe_without_errors() {
        for (String n : IdCardConsumerDemo.SAMPLES) {
            String line = IdCardConsumerDemo.describe(service, n);
            log.info(line);
            assertTrue(line.startsWith(n));
        }
    }

    @Test
    public void legacy_sample_is_reported_upgraded() {
        String line = IdCardConsumerDemo.describe(service, "632123820927051");
        assertTrue(line.contains("valid=true"));
        assertTrue(line.contains("number=632123198209270518"));
        assertTrue(line.contains("region=青海省海东地区乐都县"));
    }

    @Test
    public void taiwan_sample_reports_region_and_gender() {
        String line = IdCardConsumerDemo.describe(service, "A123456789");
        assertTrue(line.contains("tw-region=台北市"), line);
        assertTrue(line.contains("tw-gender=MALE"), line);
    }

    @Test
    public void fakes_follow_demo_options() {
        FakeOptions opts = FakeOptions.none().region("3301").minYear(1990).maxYear(2000).gender(Gender.FEMALE);
        List<String> fakes = IdCardConsumerDemo.fakes(service, opts, 5);
        assertEquals(5, fakes.size());
        for (String f : fakes) {
            Identity id = service.identity(f);
            log.info("fake={}", f);
            assertTrue(id.isValid());
            assertTrue(f.startsWith("3301"));
            int year = id.year().orElseThrow();
            assertTrue(year >= 1990 && year <= 2000);
            assertEquals(Gender.FEMALE, id.gender().orElseThrow());
        }
    }
}
