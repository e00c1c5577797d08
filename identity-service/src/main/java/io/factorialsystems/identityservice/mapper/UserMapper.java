package io.factorialsystems.identityservice.mapper;

import io.factorialsystems.identityservice.model.UserRecord;
import org.apache.ibatis.annotations.*;

@Mapper
public interface UserMapper {

    @Insert("INSERT INTO users (username, email, password_hash, role, created_at) " +
            "VALUES (#{username}, #{email}, #{passwordHash}, #{role}, #{createdAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(UserRecord user);

    @Select("SELECT id, username, email, password_hash, role, created_at " +
            "FROM users WHERE email = #{email}")
    @Results(id = "userRecord", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "username", column = "username"),
        @Result(property = "email", column = "email"),
        @Result(property = "passwordHash", column = "password_hash"),
        @Result(property = "role", column = "role"),
        @Result(property = "createdAt", column = "created_at")
    })
    UserRecord findByEmail(@Param("email") String email);

    @Select("SELECT id, username, email, role, created_at FROM users WHERE id = #{id}")
    @ResultMap("userRecord")
    UserRecord findById(@Param("id") long id);
}
