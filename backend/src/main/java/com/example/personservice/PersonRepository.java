package com.example.personservice;

import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.List;
import java.util.Optional;

/**
 * SQL access to the {@code persons} table.
 */
@Repository
public class PersonRepository {

    private static final String SELECT_COLUMNS = "SELECT id, name, age, address, work FROM persons";

    private static final RowMapper<Person> ROW_MAPPER = (rs, rowNum) -> Person.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .age(rs.getObject("age", Integer.class))
            .address(rs.getString("address"))
            .work(rs.getString("work"))
            .build();

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public PersonRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<Person> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY id", ROW_MAPPER);
    }

    public Optional<Person> findById(long id) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = :id", idParam(id), ROW_MAPPER)
                .stream()
                .findFirst();
    }

    /**
     * Same as {@link #findById(long)} but holds a row lock until the surrounding transaction ends.
     */
    public Optional<Person> findByIdForUpdate(long id) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = :id FOR UPDATE", idParam(id), ROW_MAPPER)
                .stream()
                .findFirst();
    }

    public long insert(Person person) {
        Long id = jdbcTemplate.queryForObject(
                "INSERT INTO persons (name, age, address, work) VALUES (:name, :age, :address, :work) RETURNING id",
                columnParams(person),
                Long.class);
        if (id == null) {
            throw new IllegalStateException("INSERT did not return a generated id");
        }
        return id;
    }

    public int update(Person person) {
        return jdbcTemplate.update(
                "UPDATE persons SET name = :name, age = :age, address = :address, work = :work WHERE id = :id",
                columnParams(person).addValue("id", person.getId(), Types.BIGINT));
    }

    public int deleteById(long id) {
        return jdbcTemplate.update("DELETE FROM persons WHERE id = :id", idParam(id));
    }

    private static MapSqlParameterSource idParam(long id) {
        return new MapSqlParameterSource("id", id);
    }

    private static MapSqlParameterSource columnParams(Person person) {
        return new MapSqlParameterSource()
                .addValue("name", person.getName(), Types.VARCHAR)
                .addValue("age", person.getAge(), Types.INTEGER)
                .addValue("address", person.getAddress(), Types.VARCHAR)
                .addValue("work", person.getWork(), Types.VARCHAR);
    }
}
