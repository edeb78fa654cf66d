package com.wangbin.plc.core.collector.protocol.siemens;

import com.wangbin.plc.common.exception.ConfigurationException;
import lombok.Getter;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 西门子 S7 地址，例如 DB1.10、DB1.DBW10、DB1.DBX0.3、M10、MW20、I0.1、Q0.0
 */
@Getter
public class S7Address {

    public static final int AREA_INPUTS = 0x81;
    public static final int AREA_OUTPUTS = 0x82;
    public static final int AREA_MERKER = 0x83;
    public static final int AREA_DB = 0x84;

    private static final Pattern DB_PATTERN = Pattern.compile("^DB(\\d+)\\.(?:DB([XBWD]))?(\\d+)(?:\\.([0-7]))?$");
    private static final Pattern AREA_PATTERN = Pattern.compile("^([MIQ])([XBWD])?(\\d+)(?:\\.([0-7]))?$");

    private final int areaCode;
    private final int dbNumber;
    private final int byteOffset;

    /**
     * 位号，字节地址时为 -1
     */
    private final int bit;

    public S7Address(int areaCode, int dbNumber, int byteOffset, int bit) {
        this.areaCode = areaCode;
        this.dbNumber = dbNumber;
        this.byteOffset = byteOffset;
        this.bit = bit;
    }

    public static S7Address parse(String address) {
        if (address == null || address.isBlank()) {
            throw new ConfigurationException("西门子地址不能为空");
        }
        String text = address.trim().toUpperCase(Locale.ROOT);
        Matcher db = DB_PATTERN.matcher(text);
        if (db.matches()) {
            return build(AREA_DB, Integer.parseInt(db.group(1)), db.group(2), db.group(3), db.group(4), address);
        }
        Matcher area = AREA_PATTERN.matcher(text);
        if (area.matches()) {
            int areaCode;
            switch (area.group(1)) {
                case "I":
                    areaCode = AREA_INPUTS;
                    break;
                case "Q":
                    areaCode = AREA_OUTPUTS;
                    break;
                default:
                    areaCode = AREA_MERKER;
                    break;
            }
            return build(areaCode, 0, area.group(2), area.group(3), area.group(4), address);
        }
        throw new ConfigurationException("西门子地址格式错误: " + address, null, address);
    }

    private static S7Address build(int areaCode, int dbNumber, String size, String offset, String bit, String original) {
        if ("X".equals(size) && bit == null) {
            throw new ConfigurationException("位地址缺少位号: " + original, null, original);
        }
        if (bit != null && size != null && !"X".equals(size)) {
            throw new ConfigurationException("字节/字地址不能带位号: " + original, null, original);
        }
        int byteOffset = Integer.parseInt(offset);
        if (byteOffset > 0xFFFF) {
            throw new ConfigurationException("西门子地址超出范围: " + original, null, original);
        }
        return new S7Address(areaCode, dbNumber, byteOffset, bit != null ? Integer.parseInt(bit) : -1);
    }

    public boolean isBitAddress() {
        return bit >= 0;
    }

    /**
     * 请求中使用的位地址
     */
    public int bitAddress() {
        return byteOffset * 8 + Math.max(bit, 0);
    }
}
