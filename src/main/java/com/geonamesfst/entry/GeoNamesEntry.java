package com.geonamesfst.entry;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 一条 GeoNames 地名记录，入库后不可变。
 *
 * @param id 记录唯一标识
 * @param name 规范名称（通常为英文）
 * @param latitude 纬度，无法解析时为 {@link Float#NaN}
 * @param longitude 经度，无法解析时为 {@link Float#NaN}
 * @param featureClass 要素类别，列缺失时为 {@code <missing>}
 * @param featureCode 要素代码，列缺失时为 {@code <missing>}
 * @param countryCode 国家代码，列缺失时为 {@code <missing>}
 * @param administrativeDivisions 四级行政区划
 * @param elevation 海拔（米），没有或无法解析时为 null
 */
public record GeoNamesEntry(
        long id,
        String name,
        float latitude,
        float longitude,
        String featureClass,
        String featureCode,
        String countryCode,
        AdministrativeDivisions administrativeDivisions,
        @JsonInclude(JsonInclude.Include.NON_NULL) Short elevation
) {
}
