package com.autoreports.sync.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;
import java.util.Map;

public interface AutoReportMapper {
    @Select({
            "<script>",
            "SELECT task_name FROM auto_reports WHERE task_name IN ",
            "<foreach collection='names' item='name' open='(' separator=',' close=')'>",
            "#{name}",
            "</foreach>",
            "</script>"
    })
    List<String> selectExistingTaskNames(@Param("names") List<String> names);

    @Select({
            "<script>",
            "SELECT * FROM auto_reports WHERE task_name IN ",
            "<foreach collection='names' item='name' open='(' separator=',' close=')'>",
            "#{name}",
            "</foreach>",
            "</script>"
    })
    List<Map<String, Object>> selectByTaskNames(@Param("names") List<String> names);

    // column names are substituted with ${}; they come from RecordField only
    @Insert({
            "<script>",
            "INSERT INTO auto_reports(task_name",
            "<foreach collection='columns' item='c'>, ${c.column}</foreach>",
            ", updated_at) VALUES(#{taskName}",
            "<foreach collection='columns' item='c'>, #{c.value}</foreach>",
            ", #{updatedAt})",
            "</script>"
    })
    int insertRecord(AutoReportWriteParam row);

    @Update({
            "<script>",
            "UPDATE auto_reports SET ",
            "<foreach collection='columns' item='c'>${c.column} = #{c.value}, </foreach>",
            "updated_at = #{updatedAt} WHERE task_name = #{taskName}",
            "</script>"
    })
    int updateRecord(AutoReportWriteParam row);
}
