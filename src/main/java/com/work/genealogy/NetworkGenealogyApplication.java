package com.work.genealogy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口登记 network 并解析族谱。
 */
@SpringBootApplication
public class NetworkGenealogyApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetworkGenealogyApplication.class, args);
    }
}
