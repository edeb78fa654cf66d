package com.wangbin.plc.core.collector.protocol.omron;

import com.wangbin.plc.common.exception.ConfigurationException;
import lombok.Getter;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 欧姆龙 FINS 地址，例如 D100、DM100、W10.3、CIO20.0、H5、A100
 */
@Getter
public class FinsAddress {

    private static final Pattern PATTERN = Pattern.compile("^(DM|D|CIO|C|W|H|A)(\\d+)(?:\\.(\\d{1,2}))?$");

    private final String area;
    private final int wordAddress;

    /**
     * 位号，字地址时为 -1
     */
    private final int bit;

    public FinsAddress(String area, int wordAddress, int bit) {
        this.area = area;
        this.wordAddress = wordAddress;
        this.bit = bit;
    }

    public static FinsAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw new ConfigurationException("欧姆龙地址不能为空");
        }
        Matcher matcher = PATTERN.matcher(address.trim().toUpperCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new ConfigurationException("欧姆龙地址格式错误: " + address, null, address);
        }
        String area = matcher.group(1);
        if ("DM".equals(area)) {
            area = "D";
        } else if ("C".equals(area)) {
            area = "CIO";
        }
        int word = Integer.parseInt(matcher.group(2));
        if (word > 0xFFFF) {
            throw new ConfigurationException("欧姆龙地址超出范围: " + address, null, address);
        }
        int bit = -1;
        if (matcher.group(3) != null) {
            bit = Integer.parseInt(matcher.group(3));
            if (bit > 15) {
                throw new ConfigurationException("位号必须在0-15之间: " + address, null, address);
            }
        }
        return new FinsAddress(area, word, bit);
    }

    public boolean isBitAddress() {
        return bit >= 0;
    }

    /**
     * CS/CJ 系列内存区代码
     */
    public int areaCode() {
        switch (area) {
            case "D":
                return isBitAddress() ? 0x02 : 0x82;
            case "W":
                return isBitAddress() ? 0x31 : 0xB1;
            case "H":
                return isBitAddress() ? 0x32 : 0xB2;
            case "A":
                return isBitAddress() ? 0x33 : 0xB3;
            default:
                return isBitAddress() ? 0x30 : 0xB0;
        }
    }
}
