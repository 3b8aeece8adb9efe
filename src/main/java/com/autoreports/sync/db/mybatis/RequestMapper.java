package com.autoreports.sync.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;
import java.util.Map;

public interface RequestMapper {
    @Select({
            "<script>",
            "SELECT request_id, customer_login, customer_name, customer_company, customer_orgstructure, ",
            "receiver_login, receiver_name, receiver_company, receiver_orgstructure, report_create_date ",
            "FROM requests WHERE request_id IN ",
            "<foreach collection='ids' item='id' open='(' separator=',' close=')'>",
            "#{id}",
            "</foreach>",
            "</script>"
    })
    List<Map<String, Object>> selectByRequestIds(@Param("ids") List<String> ids);
}
