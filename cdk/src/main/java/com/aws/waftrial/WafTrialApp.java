// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.aws.waftrial;

import software.amazon.awscdk.App;
import software.amazon.awscdk.Environment;
import software.amazon.awscdk.regioninfo.Fact;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.IllegalArgumentException;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class WafTrialApp {
    private static final Logger logger = LogManager.getLogger(WafTrialApp.class);

    static final String DEFAULT_STACK_NAME = "AwsWafTrialStack";

    private static final Pattern IPV4_CIDR = Pattern.compile(
        "^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})(?:/(\\d{1,2}))?$");
    private static final Pattern PREFIX_LIST_ID = Pattern.compile("^pl-[0-9a-f]+$");

    // Helper method to build an environment
    static Environment makeEnv(String account, String region) {
        return Environment.builder()
            .account(account)
            .region(region)
            .build();
    }

    public static void main(final String[] args) {
        App app = new App();

        WafTrialStackProps props = propsFromContext(app);
        new WafTrialStack(app, props.getStackName(), props);

        app.synth();
    }

    /**
     * Reads and validates the stack configuration from the CDK context, falling
     * back to environment variables.
     */
    static WafTrialStackProps propsFromContext(final App app) {
        Set<String> awsRegions = new HashSet<>(Fact.getRegions());

        String allowedIp = contextOrEnv(app, "allowed-ip", "ALLOWED_IP");
        allowedIp = (allowedIp == null) ? null : normalizeCidr(allowedIp);

        String allowedPrefixId = contextOrEnv(app, "allowed-prefix-id", "ALLOWED_PREFIX_ID");
        if (allowedPrefixId != null && !PREFIX_LIST_ID.matcher(allowedPrefixId).matches()) {
            throw new IllegalArgumentException("Invalid allowed-prefix-id: " + allowedPrefixId);
        }

        String awsAccount = contextOrEnv(app, "aws-account", "CDK_DEFAULT_ACCOUNT");

        String region = contextOrEnv(app, "region", "CDK_DEFAULT_REGION");
        region = (region == null) ? null : region.toLowerCase();
        if (region != null && !awsRegions.contains(region)) {
            throw new IllegalArgumentException("Invalid region: " + region);
        }

        String webGoatImage = contextOrEnv(app, "webgoat-image", null);
        webGoatImage = (webGoatImage == null) ? WebGoatService.DEFAULT_IMAGE : webGoatImage;

        String stackName = contextOrEnv(app, "stack-name", null);
        stackName = (stackName == null) ? DEFAULT_STACK_NAME : stackName;

        logger.info("Stack {}: account={}, region={}, image={}, allowed-ip={}, allowed-prefix-id={}",
            stackName, awsAccount, region, webGoatImage, allowedIp, allowedPrefixId);

        return WafTrialStackProps.builder()
            .env(makeEnv(awsAccount, region))
            .stackName(stackName)
            .allowedIp(allowedIp)
            .allowedPrefixId(allowedPrefixId)
            .webGoatImage(webGoatImage)
            .build();
    }

    /**
     * Validates an IPv4 address or CIDR block. A bare address is widened to
     * a /32.
     */
    static String normalizeCidr(final String value) {
        Matcher matcher = IPV4_CIDR.matcher(value);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid allowed-ip, expected an IPv4 CIDR: " + value);
        }

        for (int i = 1; i <= 4; i++) {
            if (Integer.parseInt(matcher.group(i)) > 255) {
                throw new IllegalArgumentException("Invalid allowed-ip, octet out of range: " + value);
            }
        }

        String mask = matcher.group(5);
        if (mask == null) {
            return value + "/32";
        }
        if (Integer.parseInt(mask) > 32) {
            throw new IllegalArgumentException("Invalid allowed-ip, prefix length out of range: " + value);
        }
        return value;
    }

    // Blank values count as unset
    private static String contextOrEnv(final App app, final String key, final String envVar) {
        Object value = app.getNode().tryGetContext(key);
        String resolved = (value == null) ? null : value.toString().trim();
        if ((resolved == null || resolved.isEmpty()) && envVar != null) {
            resolved = System.getenv(envVar);
            resolved = (resolved == null) ? null : resolved.trim();
        }
        return (resolved == null || resolved.isEmpty()) ? null : resolved;
    }
}
