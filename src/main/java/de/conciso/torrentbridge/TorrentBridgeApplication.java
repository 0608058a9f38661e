package de.conciso.torrentbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TorrentBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TorrentBridgeApplication.class, args);
    }
}
