// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.aws.waftrial;

import java.util.List;

/**
 * Boot commands that move sshd from port 22 to another port.
 *
 * The script stops at the first failing command, so a remap that did not
 * take effect shows up as a failed cloud-init run instead of an instance that
 * silently keeps listening on 22.
 */
final class SshPortRemap {
    static final String SSHD_CONFIG = "/etc/ssh/sshd_config";

    private SshPortRemap() {
    }

    static List<String> commands(int port) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Invalid ssh port: " + port);
        }

        return List.of(
            "set -e",
            "yum update -y",
            "yum install -y openssh-server",
            "systemctl enable sshd",
            "sed -i \"s/#Port 22/Port " + port + "/\" " + SSHD_CONFIG,
            "grep -q \"^Port " + port + "$\" " + SSHD_CONFIG,
            "systemctl restart sshd");
    }
}
