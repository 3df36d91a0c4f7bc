package com.geonamesfst.annotate;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.geonamesfst.query.SearchResultWithDistance;

/**
 * 标注结果：引用编号加上一条命中结果，JSON 输出时命中结果的字段与 reference 平铺在同一层。
 */
public record AnnotatedEntity(long reference, @JsonUnwrapped SearchResultWithDistance result) {
}
