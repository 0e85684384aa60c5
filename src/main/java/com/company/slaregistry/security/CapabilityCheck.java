package com.company.slaregistry.security;

@FunctionalInterface
public interface CapabilityCheck {

    boolean isGranted(String caller, Capability capability);
}
