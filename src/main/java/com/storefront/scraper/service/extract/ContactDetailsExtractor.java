package com.storefront.scraper.service.extract;

import com.storefront.scraper.model.RawRecord;
import com.storefront.scraper.parser.Dedup;
import com.storefront.scraper.parser.HtmlText;
import com.storefront.scraper.service.core.HomepageExtractor;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * E-mail addresses and phone numbers found in the homepage's visible text.
 * Every text node is scanned for e-mails first, then every text node for
 * phone numbers; entries are de-duplicated on the {@code (type, value)} pair.
 */
@Component
public class ContactDetailsExtractor extends HomepageExtractor<List<RawRecord>> {

    static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+(?:\\.[\\w-]+)+");

    /**
     * Optional {@code +}, then digits with interior spaces, hyphens or parentheses.
     * ASCII only: {@code \d} and {@code \s} do not match other scripts' digits
     * (Arabic-Indic, full-width) or Unicode spaces.
     */
    static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d\\s()-]{7,}\\d");

    static final int MIN_PHONE_DIGITS = 9;

    @Override
    public String category() {
        return "contact details";
    }

    @Override
    protected List<RawRecord> empty() {
        return List.of();
    }

    @Override
    protected List<RawRecord> parse(final Document homepage, final String baseUrl) {
        List<String> texts = HtmlText.strippedStrings(homepage);
        List<RawRecord.Structured> contacts = new ArrayList<>();

        for (String text : texts) {
            Matcher m = EMAIL.matcher(text);
            while (m.find()) {
                contacts.add(contact("email", m.group()));
            }
        }
        for (String text : texts) {
            Matcher m = PHONE.matcher(text);
            while (m.find()) {
                if (digitCount(m.group()) >= MIN_PHONE_DIGITS) {
                    contacts.add(contact("phone", m.group()));
                }
            }
        }
        return List.copyOf(Dedup.firstBy(contacts, r -> List.of(r.text("type"), r.text("value"))));
    }

    private static int digitCount(final String s) {
        return (int) s.chars().filter(Character::isDigit).count();
    }

    private static RawRecord.Structured contact(final String type, final String value) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("type", type);
        row.put("value", value);
        return RawRecord.of(row);
    }
}
