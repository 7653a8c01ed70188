package lark.server.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import lark.server.resp.config.ServerConfig;

public class Options {

    public static final Options defaults = new Options();

    public final ServerConfig server;

    public Options() {
        this(ConfigFactory.load());
    }

    public Options(Config config) {
        this.server = new ServerConfig(config.getConfig("lark.server"));
    }
}
