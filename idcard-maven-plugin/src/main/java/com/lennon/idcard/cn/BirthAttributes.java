package com.lennon.idcard.cn;

/**
 * Calendar lookups keyed by a birth date: western sign, sexagenary era name and zodiac animal.
 */
public final class BirthAttributes {

    private static final String[] CHINESE_ZODIAC = {
            "猪", "鼠", "牛", "虎", "兔", "龙", "蛇", "马", "羊", "猴", "鸡", "狗"
    };

    // 天干，下标 (year - 3) % 10
    private static final String[] CELESTIAL_STEM = {
            "癸", "甲", "乙", "丙", "丁", "戊", "己", "庚", "辛", "壬"
    };

    // 地支，下标 (year - 3) % 12
    private static final String[] TERRESTRIAL_BRANCH = {
            "亥", "子", "丑", "寅", "卯", "辰", "巳", "午", "未", "申", "酉", "戌"
    };

    private BirthAttributes() {}

    public static String chineseZodiac(int year) {
        return CHINESE_ZODIAC[Math.floorMod(year - 3, 12)];
    }

    public static String chineseEra(int year) {
        return CELESTIAL_STEM[Math.floorMod(year - 3, 10)] + TERRESTRIAL_BRANCH[Math.floorMod(year - 3, 12)];
    }

    public static String constellation(int month, int day) {
        if ((month == 1 && day >= 20) || (month == 2 && day <= 18)) return "水瓶座";
        if ((month == 2 && day >= 19) || (month == 3 && day <= 20)) return "双鱼座";
        if ((month == 3 && day > 20) || (month == 4 && day <= 19)) return "白羊座";
        if ((month == 4 && day >= 20) || (month == 5 && day <= 20)) return "金牛座";
        if ((month == 5 && day >= 21) || (month == 6 && day <= 21)) return "双子座";
        if ((month == 6 && day > 21) || (month == 7 && day <= 22)) return "巨蟹座";
        if ((month == 7 && day > 22) || (month == 8 && day <= 22)) return "狮子座";
        if ((month == 8 && day >= 23) || (month == 9 && day <= 22)) return "处女座";
        if ((month == 9 && day >= 23) || (month == 10 && day <= 23)) return "天秤座";
        if ((month == 10 && day > 23) || (month == 11 && day <= 22)) return "天蝎座";
        if ((month == 11 && day > 22) || (month == 12 && day <= 21)) return "射手座";
        return "摩羯座";
    }
}
