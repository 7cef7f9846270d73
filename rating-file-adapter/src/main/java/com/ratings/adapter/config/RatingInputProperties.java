package com.ratings.adapter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * How input files are read, bound from {@code rating.input.*}.
 */
@ConfigurationProperties(prefix = "rating.input")
public class RatingInputProperties {

    private Charset encoding = StandardCharsets.UTF_8;

    // Placeholder opponents used by pairing programs for a bye
    private List<String> byeNames = new ArrayList<>(List.of(
            "Bye", "A Bye", "B Bye", "Y Bye", "Z Bye", "Yy bye", "Zy bye", "Zz Bye", "ZZ Bye",
            "Bye One", "Bye Two", "Bye Three", "Bye Four"
    ));

    public boolean isBye(String name) {
        return name != null && byeNames.stream().anyMatch(bye -> bye.equalsIgnoreCase(name.strip()));
    }

    public Charset getEncoding() { return encoding; }
    public void setEncoding(Charset encoding) { this.encoding = encoding; }

    public List<String> getByeNames() { return byeNames; }
    public void setByeNames(List<String> byeNames) { this.byeNames = byeNames; }
}
