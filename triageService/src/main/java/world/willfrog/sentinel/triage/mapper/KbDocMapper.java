package world.willfrog.sentinel.triage.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import world.willfrog.sentinel.triage.entity.KbDoc;

import java.util.List;

@Mapper
public interface KbDocMapper {

    /**
     * 标题或正文命中任一关键词（不区分大小写）的文档。
     */
    @Select("<script>" +
            "SELECT id, title, anchor, content_text FROM kb_doc " +
            "<where>" +
            "<foreach collection='keywords' item='kw' separator=' OR '>" +
            "(title ILIKE CONCAT('%', #{kw}, '%') OR content_text ILIKE CONCAT('%', #{kw}, '%'))" +
            "</foreach>" +
            "</where>" +
            "LIMIT #{limit}" +
            "</script>")
    List<KbDoc> searchByKeywords(@Param("keywords") List<String> keywords, @Param("limit") int limit);
}
