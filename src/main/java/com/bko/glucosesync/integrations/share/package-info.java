@NamedInterface("share")
package com.bko.glucosesync.integrations.share;

import org.springframework.modulith.NamedInterface;
