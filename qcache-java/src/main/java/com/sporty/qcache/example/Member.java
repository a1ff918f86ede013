package com.sporty.qcache.example;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Member {
    private Long id;
    private String name;
    private Integer age;
    private String team;
    private List<String> tags;
    private Instant createTime;
    private Instant updateTime;
}
