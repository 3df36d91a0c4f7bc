package com.geonamesfst.annotate;

import com.geonamesfst.automaton.StateLimitExceededException;
import com.geonamesfst.query.InvalidQueryException;
import com.geonamesfst.query.QueryEngine;
import com.geonamesfst.query.ResultFilter;
import com.geonamesfst.query.SearchResultWithDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量实体标注：逐个实体查询、过滤并按 {@link ResultSelection} 取结果。
 *
 * 空文本、无结果或查询失败（如超出状态上限）的实体直接跳过，不影响其余实体。
 */
public class EntityAnnotator {
    private static final Logger logger = LoggerFactory.getLogger(EntityAnnotator.class);

    private final QueryEngine queryEngine;

    public EntityAnnotator(QueryEngine queryEngine) {
        this.queryEngine = queryEngine;
    }

    public List<AnnotatedEntity> annotate(List<Entity> entities, SearchMode mode, ResultSelection selection) {
        List<AnnotatedEntity> annotated = new ArrayList<>();
        int skipped = 0;
        for (Entity entity : entities) {
            List<SearchResultWithDistance> results = lookup(entity, mode);
            if (results.isEmpty()) {
                skipped++;
                continue;
            }
            if (selection == ResultSelection.ALL) {
                for (SearchResultWithDistance result : results) {
                    annotated.add(new AnnotatedEntity(entity.reference(), result));
                }
            } else {
                annotated.add(new AnnotatedEntity(entity.reference(), results.get(0)));
            }
        }
        logger.info("标注完成: 实体 {} 个, 跳过 {} 个, 输出 {} 条", entities.size(), skipped, annotated.size());
        return annotated;
    }

    private List<SearchResultWithDistance> lookup(Entity entity, SearchMode mode) {
        String text = entity.text();
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        try {
            return ResultFilter.apply(mode.search(queryEngine, text), mode.filter());
        } catch (StateLimitExceededException exception) {
            logger.warn("实体 {} 查询超出状态上限 {}，已跳过", entity.reference(), exception.getLimit());
            return List.of();
        } catch (InvalidQueryException exception) {
            logger.warn("实体 {} 查询无效，已跳过: {}", entity.reference(), exception.getMessage());
            return List.of();
        }
    }
}
