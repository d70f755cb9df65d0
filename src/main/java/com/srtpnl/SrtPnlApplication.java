package com.srtpnl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SrtPnlApplication {

    public static void main(String[] args) {
        SpringApplication.run(SrtPnlApplication.class, args);
    }
}
