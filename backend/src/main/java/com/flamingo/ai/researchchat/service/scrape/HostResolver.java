package com.flamingo.ai.researchchat.service.scrape;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** Resolves a host name to every address it maps to. */
@FunctionalInterface
public interface HostResolver {

  HostResolver SYSTEM = InetAddress::getAllByName;

  InetAddress[] resolve(String host) throws UnknownHostException;
}
