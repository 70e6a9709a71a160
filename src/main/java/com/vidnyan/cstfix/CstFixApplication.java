package com.vidnyan.cstfix;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CstFix - lint rules and fixes over a lossless syntax tree.
 */
@SpringBootApplication
public class CstFixApplication {

    public static void main(String[] args) {
        SpringApplication.run(CstFixApplication.class, args);
    }
}
