package com.geonamesfst.entry;

/**
 * 四级行政区划代码，缺失的层级为空字符串。
 */
public record AdministrativeDivisions(String admin1, String admin2, String admin3, String admin4) {

    public static final AdministrativeDivisions EMPTY = new AdministrativeDivisions("", "", "", "");

    public AdministrativeDivisions {
        admin1 = admin1 == null ? "" : admin1;
        admin2 = admin2 == null ? "" : admin2;
        admin3 = admin3 == null ? "" : admin3;
        admin4 = admin4 == null ? "" : admin4;
    }
}
