package com.autopost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 调度补偿服务启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到所有子模块中的组件与 Mapper。
 * </p>
 *
 * @author autopost
 * @since 2025-03-02
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
