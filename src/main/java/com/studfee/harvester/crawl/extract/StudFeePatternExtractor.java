package com.studfee.harvester.crawl.extract;

import com.studfee.harvester.config.HarvesterProperties;
import com.studfee.harvester.crawl.model.PageFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans auction pages for {@code "<year> Stud Fee ... $<amount>"} text. Pages are only
 * considered when they contain the configured section marker.
 */
@Component
public class StudFeePatternExtractor implements FactExtractor {
    private static final Logger log = LoggerFactory.getLogger(StudFeePatternExtractor.class);
    static final Pattern STUD_FEE = Pattern.compile(
        "(?<!\\d)(\\d{4})(?!\\d)[^$\\d]{0,40}?Fee[^$]*?\\$\\s*(\\d[\\d,]*)",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private final String sectionMarker;
    private final int minYear;
    private final int maxYear;

    public StudFeePatternExtractor(HarvesterProperties properties) {
        this.sectionMarker = properties.getCrawl().getSectionMarker();
        this.minYear = properties.getCrawl().getFactYearMin();
        this.maxYear = properties.getCrawl().getFactYearMax();
    }

    @Override
    public PageFacts extract(String body) {
        if (body == null || body.isEmpty()) {
            return PageFacts.empty();
        }
        if (sectionMarker != null && !sectionMarker.isEmpty() && !body.contains(sectionMarker)) {
            log.debug("    no {} section", sectionMarker);
            return PageFacts.empty();
        }
        PageFacts.Builder facts = PageFacts.builder();
        Matcher matcher = STUD_FEE.matcher(body);
        while (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            if (year < minYear || year > maxYear) {
                continue;
            }
            Long amount = parseAmount(matcher.group(2));
            if (amount == null) {
                continue;
            }
            facts.add(year, amount);
        }
        return facts.build();
    }

    static Long parseAmount(String raw) {
        String digits = raw.replace(",", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            log.debug("    ignoring fee amount {}: {}", raw, e.getMessage());
            return null;
        }
    }
}
