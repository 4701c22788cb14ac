package com.lennon.idcard.consumer;

import com.lennon.idcard.cn.Identity;
import com.lennon.idcard.core.IdCardService;
import com.lennon.idcard.core.IdCardServices;
import com.lennon.idcard.fake.FakeOptions;
import com.lennon.idcard.model.Gender;
import com.lennon.idcard.spi.SeededRandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple consumer demo that shows how to call the id card service.
 * Usage: pass numbers as arguments; optional -DIDCARD_SEED_HEX=<hex> (or env) makes fake numbers repeatable.
 */
public class IdCardConsumerDemo {
    private static final Logger log = LoggerFactory.getLogger(IdCardConsumerDemo.class);

    static final String[] SAMPLES = {
            "632123820927051",
            "230127197908177456",
            "21021119810503545x",
            "G123456(A)",
            "1123456(A)",
            "A123456789",
            "Q155304680"
    };

    public static void main(String[] args) {
        String hex = System.getProperty("IDCARD_SEED_HEX");
        if (hex == null || hex.isEmpty()) hex = System.getenv("IDCARD_SEED_HEX");

        IdCardService service = (hex == null || hex.isEmpty())
                ? IdCardServices.build()
                : IdCardServices.seeded(SeededRandomSource.hexToBytes(hex));

        String[] numbers = args.length > 0 ? args : SAMPLES;
        for (String n : numbers) {
            log.info("{}", describe(service, n));
        }

        FakeOptions opts = FakeOptions.none().region("3301").minYear(1990).maxYear(2000).gender(Gender.FEMALE);
        for (String fake : fakes(service, opts, 3)) {
            log.info("fake: {} -> {}", fake, describe(service, fake));
        }
    }

    static String describe(IdCardService service, String number) {
        StringBuilder sb = new StringBuilder(number).append(" valid=").append(service.validate(number));
        Identity id = service.identity(number);
        if (id.isValid()) {
            sb.append(" number=").append(id.number())
                    .append(" birth=").append(id.birthDateText().orElse("-"))
                    .append(" gender=").append(id.gender().map(Enum::name).orElse("-"))
                    .append(" province=").append(id.province().orElse("-"))
                    .append(" region=").append(id.region().orElse("-"))
                    .append(" zodiac=").append(id.chineseZodiac().orElse("-"))
                    .append(" era=").append(id.chineseEra().orElse("-"))
                    .append(" constellation=").append(id.constellation().orElse("-"));
        }
        service.taiwanRegion(number).ifPresent(r -> sb.append(" tw-region=").append(r));
        service.taiwanGender(number).ifPresent(g -> sb.append(" tw-gender=").append(g));
        return sb.toString();
    }

    static List<String> fakes(IdCardService service, FakeOptions opts, int count) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(service.fake(opts));
        }
        return out;
    }
}
