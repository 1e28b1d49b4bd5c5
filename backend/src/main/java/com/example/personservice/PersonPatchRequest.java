package com.example.personservice;

import com.fasterxml.jackson.annotation.JsonSetter;

import java.util.EnumSet;
import java.util.Set;

/**
 * Body of a partial update.
 *
 * <p>Every field is tri-state: absent from the JSON object, present with {@code null}, or present
 * with a value. Setters are only invoked by Jackson for keys that occur in the document, so
 * {@link #isPresent(Field)} tells an omitted key apart from an explicit {@code null}.
 */
public class PersonPatchRequest {

    public enum Field { NAME, AGE, ADDRESS, WORK }

    private final Set<Field> present = EnumSet.noneOf(Field.class);

    private String name;
    private Integer age;
    private String address;
    private String work;

    public String getName() {
        return name;
    }

    @JsonSetter("name")
    public void setName(String name) {
        this.name = name;
        present.add(Field.NAME);
    }

    public Integer getAge() {
        return age;
    }

    @JsonSetter("age")
    public void setAge(Integer age) {
        this.age = age;
        present.add(Field.AGE);
    }

    public String getAddress() {
        return address;
    }

    @JsonSetter("address")
    public void setAddress(String address) {
        this.address = address;
        present.add(Field.ADDRESS);
    }

    public String getWork() {
        return work;
    }

    @JsonSetter("work")
    public void setWork(String work) {
        this.work = work;
        present.add(Field.WORK);
    }

    public boolean isPresent(Field field) {
        return present.contains(field);
    }

    public boolean isExplicitNull(Field field) {
        return isPresent(field) && valueOf(field) == null;
    }

    /**
     * Applies the fields that carry a value to {@code current}. Absent fields and fields sent as
     * {@code null} keep the stored value, so {@code {"age": null}} does not clear {@code age}.
     */
    public Person mergeInto(Person current) {
        Person merged = current.toBuilder().build();
        if (name != null) {
            merged.setName(name);
        }
        if (age != null) {
            merged.setAge(age);
        }
        if (address != null) {
            merged.setAddress(address);
        }
        if (work != null) {
            merged.setWork(work);
        }
        return merged;
    }

    private Object valueOf(Field field) {
        switch (field) {
            case NAME:
                return name;
            case AGE:
                return age;
            case ADDRESS:
                return address;
            case WORK:
                return work;
            default:
                throw new IllegalArgumentException("Unknown field " + field);
        }
    }
}
