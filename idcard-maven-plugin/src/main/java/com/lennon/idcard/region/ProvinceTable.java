package com.lennon.idcard.region;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Two-digit province prefix of a Mainland number. 71 and 83 both name Taiwan.
 */
public final class ProvinceTable {

    public static final ProvinceTable DEFAULT = new ProvinceTable(defaultEntries());

    private final Map<String, String> names;

    public ProvinceTable(Map<String, String> names) {
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
    }

    public Optional<String> lookup(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(names.get(code));
    }

    public boolean contains(String code) {
        return code != null && names.containsKey(code);
    }

    public int size() { return names.size(); }

    private static Map<String, String> defaultEntries() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("11", "北京");
        m.put("12", "天津");
        m.put("13", "河北");
        m.put("14", "山西");
        m.put("15", "内蒙古");
        m.put("21", "辽宁");
        m.put("22", "吉林");
        m.put("23", "黑龙江");
        m.put("31", "上海");
        m.put("32", "江苏");
        m.put("33", "浙江");
        m.put("34", "安徽");
        m.put("35", "福建");
        m.put("36", "江西");
        m.put("37", "山东");
        m.put("41", "河南");
        m.put("42", "湖北");
        m.put("43", "湖南");
        m.put("44", "广东");
        m.put("45", "广西");
        m.put("46", "海南");
        m.put("50", "重庆");
        m.put("51", "四川");
        m.put("52", "贵州");
        m.put("53", "云南");
        m.put("54", "西藏");
        m.put("61", "陕西");
        m.put("62", "甘肃");
        m.put("63", "青海");
        m.put("64", "宁夏");
        m.put("65", "新疆");
        m.put("71", "台湾");
        m.put("81", "香港");
        m.put("82", "澳门");
        m.put("83", "台湾");
        m.put("91", "国外");
        return m;
    }
}
