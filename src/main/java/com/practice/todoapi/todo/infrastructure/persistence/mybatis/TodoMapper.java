package com.practice.todoapi.todo.infrastructure.persistence.mybatis;

import java.util.List;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import com.practice.todoapi.todo.domain.model.Todo;

@Mapper
public interface TodoMapper {
    Todo selectById(@Param("id") long id);
    List<Todo> selectPage(@Param("completed") Boolean completed, @Param("limit") int limit, @Param("offset") int offset);
    int insert(Todo todo);
    int update(TodoUpdateRow row);
    int deleteById(@Param("id") long id);
}
