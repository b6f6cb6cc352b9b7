package com.example.resilience.cache;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 메모이제이션 키 생성에 쓰이는 호출 인자 묶음
 * 위치 인자와 이름 있는 인자를 구분하며, 이름 있는 인자는 이름 순으로 정렬되어 추가 순서가 키에 영향을 주지 않습니다.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CallArguments {

    private static final CallArguments EMPTY = new CallArguments(Collections.emptyList(), new TreeMap<>());

    private final List<Object> positional; // 위치 인자
    private final SortedMap<String, Object> named; // 이름 있는 인자 (이름 순 정렬)

    private CallArguments(List<Object> positional, SortedMap<String, Object> named) {
        this.positional = Collections.unmodifiableList(positional);
        this.named = Collections.unmodifiableSortedMap(named);
    }

    public static CallArguments empty() {
        return EMPTY;
    }

    public static CallArguments of(Object... positional) {
        return new CallArguments(new ArrayList<>(Arrays.asList(positional)), new TreeMap<>());
    }

    //이름 있는 인자를 추가한 새 인스턴스 반환
    public CallArguments with(String name, Object value) {
        Objects.requireNonNull(name, "name");
        TreeMap<String, Object> copy = new TreeMap<>(named);
        copy.put(name, value);
        return new CallArguments(new ArrayList<>(positional), copy);
    }
}
